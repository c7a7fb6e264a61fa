package work.lcod.scals.ir;

public record UnitPoint(double x, double y) {
    public static final UnitPoint TOP = new UnitPoint(0.5, 0);
    public static final UnitPoint BOTTOM = new UnitPoint(0.5, 1);
    public static final UnitPoint LEADING = new UnitPoint(0, 0.5);
    public static final UnitPoint TRAILING = new UnitPoint(1, 0.5);
    public static final UnitPoint CENTER = new UnitPoint(0.5, 0.5);

    public static UnitPoint named(String name, UnitPoint fallback) {
        if (name == null) {
            return fallback;
        }
        switch (name) {
            case "top":
                return TOP;
            case "bottom":
                return BOTTOM;
            case "leading":
                return LEADING;
            case "trailing":
                return TRAILING;
            case "center":
                return CENTER;
            case "topLeading":
                return new UnitPoint(0, 0);
            case "topTrailing":
                return new UnitPoint(1, 0);
            case "bottomLeading":
                return new UnitPoint(0, 1);
            case "bottomTrailing":
                return new UnitPoint(1, 1);
            default:
                return fallback;
        }
    }
}
