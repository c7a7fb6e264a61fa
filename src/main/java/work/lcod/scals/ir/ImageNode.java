package work.lcod.scals.ir;

public record ImageNode(
    String id,
    String styleId,
    ImageSource source,
    ImageSource placeholder,
    ImageSource loading,
    ActionRef onTap,
    Color tintColor,
    EdgeInsets padding,
    Decoration decoration,
    Frame frame
) implements RenderNode {
    public static final String KIND = "image";

    @Override
    public String kind() {
        return KIND;
    }
}
