package work.lcod.scals.ir;

/**
 * Background, corner rounding, shadow and border. Shadow and border are absent when not styled.
 */
public record Decoration(Color backgroundColor, double cornerRadius, Shadow shadow, Border border) {
    public static final Decoration NONE = new Decoration(Color.CLEAR, 0, null, null);
}
