package work.lcod.scals.document;

import work.lcod.scals.ir.EdgeInsets;

/**
 * Padding as written in a document. Specific edges win over the {@code horizontal}/{@code vertical}
 * shorthands, which win over {@code all}. A padding with every field absent is the clear sentinel
 * when it appears inside a style.
 */
public record Padding(
    Double top,
    Double bottom,
    Double leading,
    Double trailing,
    Double horizontal,
    Double vertical,
    Double all
) {
    public static final Padding CLEAR = new Padding(null, null, null, null, null, null, null);

    public static Padding uniform(double value) {
        return new Padding(null, null, null, null, null, null, value);
    }

    public boolean isClear() {
        return top == null && bottom == null && leading == null && trailing == null
            && horizontal == null && vertical == null && all == null;
    }

    public Double resolvedTop() {
        return first(top, vertical, all);
    }

    public Double resolvedBottom() {
        return first(bottom, vertical, all);
    }

    public Double resolvedLeading() {
        return first(leading, horizontal, all);
    }

    public Double resolvedTrailing() {
        return first(trailing, horizontal, all);
    }

    public EdgeInsets toEdgeInsets() {
        return new EdgeInsets(
            orZero(resolvedTop()),
            orZero(resolvedBottom()),
            orZero(resolvedLeading()),
            orZero(resolvedTrailing())
        );
    }

    private static Double first(Double specific, Double axis, Double all) {
        if (specific != null) return specific;
        if (axis != null) return axis;
        return all;
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
