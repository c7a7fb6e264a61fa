package work.lcod.scals.ir;

public record EdgeInsets(double top, double bottom, double leading, double trailing) {
    public static final EdgeInsets ZERO = new EdgeInsets(0, 0, 0, 0);

    public static EdgeInsets all(double value) {
        return new EdgeInsets(value, value, value, value);
    }
}
