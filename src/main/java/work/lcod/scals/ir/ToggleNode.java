package work.lcod.scals.ir;

public record ToggleNode(
    String id,
    String styleId,
    String bindingPath,
    boolean isOn,
    Color tintColor,
    ActionRef onValueChanged,
    EdgeInsets padding,
    Frame frame
) implements RenderNode {
    public static final String KIND = "toggle";

    @Override
    public String kind() {
        return KIND;
    }
}
