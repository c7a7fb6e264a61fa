package work.lcod.scals.document;

public record Spacer(Double minLength, Double width, Double height) implements LayoutNode {
    public static final String KIND = "spacer";

    @Override
    public String kind() {
        return KIND;
    }
}
