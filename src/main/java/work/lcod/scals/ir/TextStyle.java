package work.lcod.scals.ir;

public record TextStyle(
    String fontFamily,
    double fontSize,
    FontWeight fontWeight,
    Color textColor,
    TextAlignment textAlignment
) {
    public static final double DEFAULT_FONT_SIZE = 17;
    public static final TextStyle DEFAULT =
        new TextStyle(null, DEFAULT_FONT_SIZE, FontWeight.REGULAR, Color.BLACK, TextAlignment.LEADING);
}
