package work.lcod.scals.ir;

public record SliderNode(
    String id,
    String styleId,
    String bindingPath,
    double value,
    double minValue,
    double maxValue,
    Color tintColor,
    ActionRef onValueChanged,
    EdgeInsets padding,
    Frame frame
) implements RenderNode {
    public static final String KIND = "slider";

    @Override
    public String kind() {
        return KIND;
    }
}
