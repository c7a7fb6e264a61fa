package work.lcod.scals.ir;

/**
 * Text with its content already resolved. {@code bindingPath} or {@code bindingTemplate} record
 * where dynamic content came from.
 */
public record TextNode(
    String id,
    String styleId,
    String content,
    String bindingPath,
    String bindingTemplate,
    TextStyle textStyle,
    EdgeInsets padding,
    Decoration decoration,
    Frame frame
) implements RenderNode {
    public static final String KIND = "text";

    @Override
    public String kind() {
        return KIND;
    }

    public boolean isDynamic() {
        return bindingPath != null || bindingTemplate != null;
    }
}
