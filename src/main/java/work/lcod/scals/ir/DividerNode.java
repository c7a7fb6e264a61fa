package work.lcod.scals.ir;

public record DividerNode(String id, Color color, double thickness, EdgeInsets padding) implements RenderNode {
    public static final String KIND = "divider";

    @Override
    public String kind() {
        return KIND;
    }
}
