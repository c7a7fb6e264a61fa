package work.lcod.scals.ir;

import java.util.List;

/**
 * Top of the render tree.
 *
 * @param edgeInsets absent when the document leaves the safe area untouched
 */
public record RootNode(
    Color backgroundColor,
    SafeAreaInsets edgeInsets,
    ColorScheme colorScheme,
    ActionRef onAppear,
    ActionRef onDisappear,
    EdgeInsets padding,
    double cornerRadius,
    Shadow shadow,
    Border border,
    List<RenderNode> children
) {
    public RootNode {
        children = List.copyOf(children);
    }

    public RootNode withChildren(List<RenderNode> newChildren) {
        return new RootNode(backgroundColor, edgeInsets, colorScheme, onAppear, onDisappear, padding,
            cornerRadius, shadow, border, newChildren);
    }
}
