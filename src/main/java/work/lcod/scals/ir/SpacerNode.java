package work.lcod.scals.ir;

/**
 * Flexible space. Absent sizes let the spacer grow.
 */
public record SpacerNode(String id, Double minLength, Double width, Double height) implements RenderNode {
    public static final String KIND = "spacer";

    @Override
    public String kind() {
        return KIND;
    }
}
