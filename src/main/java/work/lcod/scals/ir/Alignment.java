package work.lcod.scals.ir;

import java.util.Locale;

/**
 * Two-axis alignment. String shortcuts such as {@code topLeading} or {@code bottom} map onto both
 * axes; unknown names fall back to center.
 */
public record Alignment(Horizontal horizontal, Vertical vertical) {
    public static final Alignment CENTER = new Alignment(Horizontal.CENTER, Vertical.CENTER);

    public enum Horizontal {
        LEADING, CENTER, TRAILING;

        public static Horizontal from(String value) {
            if (value == null) {
                return CENTER;
            }
            switch (value.toLowerCase(Locale.ROOT)) {
                case "leading":
                case "left":
                    return LEADING;
                case "trailing":
                case "right":
                    return TRAILING;
                default:
                    return CENTER;
            }
        }
    }

    public enum Vertical {
        TOP, CENTER, BOTTOM;

        public static Vertical from(String value) {
            if (value == null) {
                return CENTER;
            }
            switch (value.toLowerCase(Locale.ROOT)) {
                case "top":
                    return TOP;
                case "bottom":
                    return BOTTOM;
                default:
                    return CENTER;
            }
        }
    }

    public static Alignment fromShortcut(String name) {
        if (name == null) {
            return CENTER;
        }
        switch (name) {
            case "topLeading":
                return new Alignment(Horizontal.LEADING, Vertical.TOP);
            case "top":
                return new Alignment(Horizontal.CENTER, Vertical.TOP);
            case "topTrailing":
                return new Alignment(Horizontal.TRAILING, Vertical.TOP);
            case "leading":
                return new Alignment(Horizontal.LEADING, Vertical.CENTER);
            case "trailing":
                return new Alignment(Horizontal.TRAILING, Vertical.CENTER);
            case "bottomLeading":
                return new Alignment(Horizontal.LEADING, Vertical.BOTTOM);
            case "bottom":
                return new Alignment(Horizontal.CENTER, Vertical.BOTTOM);
            case "bottomTrailing":
                return new Alignment(Horizontal.TRAILING, Vertical.BOTTOM);
            default:
                return CENTER;
        }
    }

    public static Alignment of(String horizontal, String vertical) {
        return new Alignment(Horizontal.from(horizontal), Vertical.from(vertical));
    }
}
