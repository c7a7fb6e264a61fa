package work.lcod.scals.ir;

/**
 * Root edge insets; each edge is measured from the safe area or from the screen edge. Absent
 * edges are {@code null}.
 */
public record SafeAreaInsets(Inset top, Inset bottom, Inset leading, Inset trailing) {
    public enum Positioning { SAFE_AREA, ABSOLUTE }

    public record Inset(Positioning positioning, double value) {}

    public boolean isEmpty() {
        return top == null && bottom == null && leading == null && trailing == null;
    }
}
