package work.lcod.scals.style;

import work.lcod.scals.document.Padding;
import work.lcod.scals.document.Style;
import work.lcod.scals.ir.Border;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.Dimension;
import work.lcod.scals.ir.EdgeInsets;
import work.lcod.scals.ir.FontWeight;
import work.lcod.scals.ir.Shadow;
import work.lcod.scals.ir.TextAlignment;

/**
 * Result of folding a style inheritance chain. Lives only for the duration of one node's
 * resolution; resolvers copy what they need onto IR nodes.
 *
 * <p>Composites (shadow, padding) are stored per sub-field so that an ancestor can set one edge
 * and a descendant another. A clear instruction drops every sub-field at once.
 */
public final class ResolvedStyle {
    private String fontFamily;
    private Double fontSize;
    private FontWeight fontWeight;
    private Color textColor;
    private TextAlignment textAlignment;
    private Color backgroundColor;
    private Double cornerRadius;
    private Double borderWidth;
    private Color borderColor;
    private Color shadowColor;
    private Double shadowRadius;
    private Double shadowX;
    private Double shadowY;
    private Color tintColor;
    private Dimension width;
    private Dimension height;
    private Dimension minWidth;
    private Dimension minHeight;
    private Dimension maxWidth;
    private Dimension maxHeight;
    private Double paddingTop;
    private Double paddingBottom;
    private Double paddingLeading;
    private Double paddingTrailing;

    ResolvedStyle() {}

    public static ResolvedStyle empty() {
        return new ResolvedStyle();
    }

    /** A style folded on its own, ignoring its {@code inherits} reference. */
    public static ResolvedStyle of(Style style) {
        var resolved = new ResolvedStyle();
        resolved.merge(style);
        return resolved;
    }

    void merge(Style style) {
        if (style == null) {
            return;
        }
        if (style.fontFamily() != null) fontFamily = style.fontFamily();
        if (style.fontSize() != null) fontSize = style.fontSize();
        if (style.fontWeight() != null) fontWeight = style.fontWeight();
        if (style.textColor() != null) textColor = Color.parse(style.textColor());
        if (style.textAlignment() != null) textAlignment = style.textAlignment();
        if (style.backgroundColor() != null) backgroundColor = Color.parse(style.backgroundColor());
        if (style.cornerRadius() != null) cornerRadius = style.cornerRadius();
        if (style.borderWidth() != null) borderWidth = style.borderWidth();
        if (style.borderColor() != null) borderColor = Color.parse(style.borderColor());
        if (style.tintColor() != null) tintColor = Color.parse(style.tintColor());

        var shadow = style.shadow();
        if (shadow != null) {
            if (shadow.isClear()) {
                shadowColor = null;
                shadowRadius = null;
                shadowX = null;
                shadowY = null;
            } else {
                if (shadow.color() != null) shadowColor = Color.parse(shadow.color());
                if (shadow.radius() != null) shadowRadius = shadow.radius();
                if (shadow.x() != null) shadowX = shadow.x();
                if (shadow.y() != null) shadowY = shadow.y();
            }
        }

        // Dimensions replace wholesale; absolute and fractional never mix.
        if (style.width() != null) width = style.width();
        if (style.height() != null) height = style.height();
        if (style.minWidth() != null) minWidth = style.minWidth();
        if (style.minHeight() != null) minHeight = style.minHeight();
        if (style.maxWidth() != null) maxWidth = style.maxWidth();
        if (style.maxHeight() != null) maxHeight = style.maxHeight();

        mergePadding(style.padding());
    }

    private void mergePadding(Padding padding) {
        if (padding == null) {
            return;
        }
        if (padding.isClear()) {
            paddingTop = null;
            paddingBottom = null;
            paddingLeading = null;
            paddingTrailing = null;
            return;
        }
        if (padding.resolvedTop() != null) paddingTop = padding.resolvedTop();
        if (padding.resolvedBottom() != null) paddingBottom = padding.resolvedBottom();
        if (padding.resolvedLeading() != null) paddingLeading = padding.resolvedLeading();
        if (padding.resolvedTrailing() != null) paddingTrailing = padding.resolvedTrailing();
    }

    public String fontFamily() {
        return fontFamily;
    }

    public Double fontSize() {
        return fontSize;
    }

    public FontWeight fontWeight() {
        return fontWeight;
    }

    public Color textColor() {
        return textColor;
    }

    public TextAlignment textAlignment() {
        return textAlignment;
    }

    public Color backgroundColor() {
        return backgroundColor;
    }

    public Double cornerRadius() {
        return cornerRadius;
    }

    public Double borderWidth() {
        return borderWidth;
    }

    public Color borderColor() {
        return borderColor;
    }

    public Color shadowColor() {
        return shadowColor;
    }

    public Double shadowRadius() {
        return shadowRadius;
    }

    public Double shadowX() {
        return shadowX;
    }

    public Double shadowY() {
        return shadowY;
    }

    public Color tintColor() {
        return tintColor;
    }

    public Dimension width() {
        return width;
    }

    public Dimension height() {
        return height;
    }

    public Dimension minWidth() {
        return minWidth;
    }

    public Dimension minHeight() {
        return minHeight;
    }

    public Dimension maxWidth() {
        return maxWidth;
    }

    public Dimension maxHeight() {
        return maxHeight;
    }

    public Double paddingTop() {
        return paddingTop;
    }

    public Double paddingBottom() {
        return paddingBottom;
    }

    public Double paddingLeading() {
        return paddingLeading;
    }

    public Double paddingTrailing() {
        return paddingTrailing;
    }

    public boolean hasShadow() {
        return shadowColor != null || shadowRadius != null || shadowX != null || shadowY != null;
    }

    public boolean hasPadding() {
        return paddingTop != null || paddingBottom != null || paddingLeading != null || paddingTrailing != null;
    }

    public boolean hasBorder() {
        return borderColor != null && borderWidth != null && borderWidth > 0;
    }

    /** {@code null} when no shadow sub-field is set. Missing sub-fields default to zero and translucent black. */
    public Shadow shadow() {
        if (!hasShadow()) {
            return null;
        }
        return new Shadow(
            shadowColor == null ? new Color(0, 0, 0, 0.33) : shadowColor,
            orZero(shadowRadius),
            orZero(shadowX),
            orZero(shadowY)
        );
    }

    public Border border() {
        return hasBorder() ? new Border(borderColor, borderWidth) : null;
    }

    public EdgeInsets padding() {
        return new EdgeInsets(orZero(paddingTop), orZero(paddingBottom), orZero(paddingLeading), orZero(paddingTrailing));
    }

    /**
     * Padding with the node's own edges laid over the style's, edge by edge.
     */
    public EdgeInsets paddingWith(Padding override) {
        if (override == null) {
            return padding();
        }
        return new EdgeInsets(
            firstNonNull(override.resolvedTop(), paddingTop),
            firstNonNull(override.resolvedBottom(), paddingBottom),
            firstNonNull(override.resolvedLeading(), paddingLeading),
            firstNonNull(override.resolvedTrailing(), paddingTrailing)
        );
    }

    private static double firstNonNull(Double preferred, Double fallback) {
        if (preferred != null) return preferred;
        return orZero(fallback);
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
