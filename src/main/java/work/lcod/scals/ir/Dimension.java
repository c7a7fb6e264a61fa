package work.lcod.scals.ir;

/**
 * A size that is either absolute points or a fraction of the container.
 */
public record Dimension(Kind kind, double value) {
    public enum Kind { ABSOLUTE, FRACTIONAL }

    public static Dimension absolute(double value) {
        return new Dimension(Kind.ABSOLUTE, value);
    }

    public static Dimension fractional(double value) {
        return new Dimension(Kind.FRACTIONAL, value);
    }
}
