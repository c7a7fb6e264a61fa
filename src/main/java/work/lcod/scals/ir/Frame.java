package work.lcod.scals.ir;

/**
 * Size constraints. A {@code null} dimension means the renderer sizes the node to fit.
 */
public record Frame(
    Dimension width,
    Dimension height,
    Dimension minWidth,
    Dimension minHeight,
    Dimension maxWidth,
    Dimension maxHeight
) {
    public static final Frame NONE = new Frame(null, null, null, null, null, null);
}
