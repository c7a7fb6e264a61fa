package work.lcod.scals.ir;

public enum ColorScheme {
    LIGHT, DARK, SYSTEM;

    public static ColorScheme from(String value) {
        if ("light".equals(value)) return LIGHT;
        if ("dark".equals(value)) return DARK;
        return SYSTEM;
    }
}
