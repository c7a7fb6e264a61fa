package work.lcod.scals.ir;

public record ButtonNode(
    String id,
    String styleId,
    String label,
    Styles styles,
    String isSelectedBinding,
    boolean selected,
    boolean fillWidth,
    ActionRef onTap,
    ImageSource image,
    ImagePlacement imagePlacement,
    double imageSpacing,
    ButtonShape buttonShape
) implements RenderNode {
    public static final String KIND = "button";

    public enum ImagePlacement {
        LEADING, TRAILING, TOP, BOTTOM;

        public static ImagePlacement from(String value) {
            if ("trailing".equals(value)) return TRAILING;
            if ("top".equals(value)) return TOP;
            if ("bottom".equals(value)) return BOTTOM;
            return LEADING;
        }
    }

    public enum ButtonShape {
        CIRCLE, CAPSULE, ROUNDED_SQUARE;

        /** {@code null} for unknown or absent names. */
        public static ButtonShape from(String value) {
            if ("circle".equals(value)) return CIRCLE;
            if ("capsule".equals(value)) return CAPSULE;
            if ("roundedSquare".equals(value)) return ROUNDED_SQUARE;
            return null;
        }
    }

    /** Appearance for one interaction state. */
    public record StateStyle(
        TextStyle textStyle,
        Decoration decoration,
        Color tintColor,
        EdgeInsets padding,
        Frame frame
    ) {}

    /** {@code selected} and {@code disabled} are absent when the document only styles the normal state. */
    public record Styles(StateStyle normal, StateStyle selected, StateStyle disabled) {
        public StateStyle style(boolean isSelected, boolean isDisabled) {
            if (isDisabled && disabled != null) {
                return disabled;
            }
            if (isSelected && selected != null) {
                return selected;
            }
            return normal;
        }
    }

    @Override
    public String kind() {
        return KIND;
    }

    public StateStyle currentStyle() {
        return styles.style(selected, false);
    }
}
