package work.lcod.scals.ir;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * RGBA color with components in {@code [0, 1]}.
 */
public record Color(double red, double green, double blue, double alpha) {
    public static final Color CLEAR = new Color(0, 0, 0, 0);
    public static final Color BLACK = new Color(0, 0, 0, 1);
    public static final Color WHITE = new Color(1, 1, 1, 1);

    private static final String NUMBER = "(\\d+(?:\\.\\d*)?|\\.\\d+)";
    private static final Pattern RGBA = Pattern.compile(
        "rgba?\\(\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*(?:,\\s*" + NUMBER + "\\s*)?\\)"
    );
    private static final Pattern HEX = Pattern.compile("#?([0-9a-f]{3}|[0-9a-f]{6}|[0-9a-f]{8})");

    /**
     * Parses {@code #RGB}, {@code #RRGGBB}, {@code #RRGGBBAA}, {@code rgb(r,g,b)},
     * {@code rgba(r,g,b,a)} and {@code clear}. Anything else yields opaque black.
     */
    public static Color parse(String text) {
        if (text == null) {
            return BLACK;
        }
        var value = text.trim().toLowerCase(Locale.ROOT);
        if ("clear".equals(value) || "transparent".equals(value)) {
            return CLEAR;
        }
        var rgba = RGBA.matcher(value);
        if (rgba.matches()) {
            double alpha = rgba.group(4) == null ? 1 : Double.parseDouble(rgba.group(4));
            return new Color(
                Double.parseDouble(rgba.group(1)) / 255.0,
                Double.parseDouble(rgba.group(2)) / 255.0,
                Double.parseDouble(rgba.group(3)) / 255.0,
                alpha
            );
        }
        var hex = value.startsWith("#") ? value.substring(1) : value;
        if (!hex.matches("[0-9a-f]+")) {
            return BLACK;
        }
        switch (hex.length()) {
            case 3:
                return new Color(
                    channel(hex.substring(0, 1).repeat(2)),
                    channel(hex.substring(1, 2).repeat(2)),
                    channel(hex.substring(2, 3).repeat(2)),
                    1
                );
            case 6:
                return new Color(channel(hex.substring(0, 2)), channel(hex.substring(2, 4)), channel(hex.substring(4, 6)), 1);
            case 8:
                return new Color(
                    channel(hex.substring(0, 2)),
                    channel(hex.substring(2, 4)),
                    channel(hex.substring(4, 6)),
                    channel(hex.substring(6, 8))
                );
            default:
                return BLACK;
        }
    }

    /** Whether {@link #parse} understands {@code text} rather than falling back to black. */
    public static boolean isValid(String text) {
        if (text == null) {
            return false;
        }
        var value = text.trim().toLowerCase(Locale.ROOT);
        return "clear".equals(value) || "transparent".equals(value)
            || RGBA.matcher(value).matches() || HEX.matcher(value).matches();
    }

    /** Parses when present, otherwise returns {@code null}. */
    public static Color parseOptional(String text) {
        return text == null ? null : parse(text);
    }

    private static double channel(String hex) {
        return Integer.parseInt(hex, 16) / 255.0;
    }
}
