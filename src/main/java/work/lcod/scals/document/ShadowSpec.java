package work.lcod.scals.document;

/**
 * Shadow as written in a style. Every field absent is the clear sentinel.
 */
public record ShadowSpec(String color, Double radius, Double x, Double y) {
    public boolean isClear() {
        return color == null && radius == null && x == null && y == null;
    }
}
