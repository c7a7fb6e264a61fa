package work.lcod.scals.ir;

/**
 * Editable text bound two-way to {@code bindingPath}; {@code value} is the bound text at resolution time.
 */
public record TextFieldNode(
    String id,
    String styleId,
    String placeholder,
    String bindingPath,
    String value,
    TextStyle textStyle,
    EdgeInsets padding,
    Decoration decoration,
    Frame frame
) implements RenderNode {
    public static final String KIND = "textfield";

    @Override
    public String kind() {
        return KIND;
    }
}
