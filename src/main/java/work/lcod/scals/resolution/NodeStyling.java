package work.lcod.scals.resolution;

import work.lcod.scals.document.Padding;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.Decoration;
import work.lcod.scals.ir.EdgeInsets;
import work.lcod.scals.ir.FontWeight;
import work.lcod.scals.ir.Frame;
import work.lcod.scals.ir.TextAlignment;
import work.lcod.scals.ir.TextStyle;
import work.lcod.scals.style.ResolvedStyle;

/**
 * Flattens a {@link ResolvedStyle} into the concrete IR groups, applying IR defaults.
 */
public final class NodeStyling {
    private NodeStyling() {}

    public static Decoration decoration(ResolvedStyle style) {
        return new Decoration(
            style.backgroundColor() == null ? Color.CLEAR : style.backgroundColor(),
            style.cornerRadius() == null ? 0 : style.cornerRadius(),
            style.shadow(),
            style.border()
        );
    }

    public static Frame frame(ResolvedStyle style) {
        return new Frame(
            style.width(),
            style.height(),
            style.minWidth(),
            style.minHeight(),
            style.maxWidth(),
            style.maxHeight()
        );
    }

    public static TextStyle textStyle(ResolvedStyle style) {
        return new TextStyle(
            style.fontFamily(),
            style.fontSize() == null ? TextStyle.DEFAULT_FONT_SIZE : style.fontSize(),
            style.fontWeight() == null ? FontWeight.REGULAR : style.fontWeight(),
            style.textColor() == null ? Color.BLACK : style.textColor(),
            style.textAlignment() == null ? TextAlignment.LEADING : style.textAlignment()
        );
    }

    /** Node padding overrides style padding edge by edge. */
    public static EdgeInsets padding(ResolvedStyle style, Padding nodePadding) {
        return style.paddingWith(nodePadding);
    }

    public static Color tint(ResolvedStyle style, Color fallback) {
        return style.tintColor() == null ? fallback : style.tintColor();
    }
}
