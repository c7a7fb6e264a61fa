package work.lcod.scals.ir;

import java.util.List;

public enum TextAlignment {
    LEADING, CENTER, TRAILING;

    public static final List<String> WIRE_NAMES = List.of("leading", "center", "trailing");

    /** Returns {@code null} for unknown names. */
    public static TextAlignment fromWireName(String name) {
        if ("leading".equals(name)) return LEADING;
        if ("center".equals(name)) return CENTER;
        if ("trailing".equals(name)) return TRAILING;
        return null;
    }
}
