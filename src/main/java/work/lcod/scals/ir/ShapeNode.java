package work.lcod.scals.ir;

public record ShapeNode(
    String id,
    ShapeType shapeType,
    double cornerRadius,
    Color fillColor,
    Color strokeColor,
    double strokeWidth,
    EdgeInsets padding,
    Frame frame
) implements RenderNode {
    public static final String KIND = "shape";

    public enum ShapeType {
        RECTANGLE, CIRCLE, ROUNDED_RECTANGLE, CAPSULE, ELLIPSE;

        public static ShapeType from(String value) {
            if (value == null) {
                return RECTANGLE;
            }
            switch (value) {
                case "circle":
                    return CIRCLE;
                case "roundedRectangle":
                    return ROUNDED_RECTANGLE;
                case "capsule":
                    return CAPSULE;
                case "ellipse":
                    return ELLIPSE;
                default:
                    return RECTANGLE;
            }
        }
    }

    @Override
    public String kind() {
        return KIND;
    }
}
