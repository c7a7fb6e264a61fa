package work.lcod.scals.ir;

import java.util.List;

public record GradientNode(
    String id,
    GradientType gradientType,
    List<ColorStop> colors,
    UnitPoint startPoint,
    UnitPoint endPoint,
    double cornerRadius,
    EdgeInsets padding,
    Frame frame
) implements RenderNode {
    public static final String KIND = "gradient";

    public enum GradientType {
        LINEAR, RADIAL;

        public static GradientType from(String value) {
            return "radial".equals(value) ? RADIAL : LINEAR;
        }
    }

    /**
     * Stop color for light and dark appearance; both are equal for a fixed color.
     */
    public record GradientColor(Color light, Color dark) {
        public static GradientColor fixed(Color color) {
            return new GradientColor(color, color);
        }

        public boolean isAdaptive() {
            return !light.equals(dark);
        }

        public Color resolve(ColorScheme scheme, boolean systemDark) {
            switch (scheme) {
                case DARK:
                    return dark;
                case LIGHT:
                    return light;
                default:
                    return systemDark ? dark : light;
            }
        }
    }

    public record ColorStop(GradientColor color, double location) {}

    public GradientNode {
        colors = List.copyOf(colors);
    }

    @Override
    public String kind() {
        return KIND;
    }
}
