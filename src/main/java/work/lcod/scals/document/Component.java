package work.lcod.scals.document;

import java.util.List;
import java.util.Map;
import work.lcod.scals.state.JsonValue;

/**
 * Leaf component. {@code type} is open: built-in kinds and host-registered custom kinds share it.
 * {@code properties} keeps every raw field, including ones this model does not know about.
 */
public record Component(
    String type,
    String id,
    String styleId,
    Style style,
    StateStyles styles,
    Padding padding,
    String text,
    String placeholder,
    String bind,
    String dataSourceId,
    Map<String, DataReference> data,
    ActionBinding onTap,
    ActionBinding onValueChanged,
    String isSelectedBinding,
    boolean fillWidth,
    Map<String, JsonValue> state,
    Double minValue,
    Double maxValue,
    ImageSpec image,
    String imagePlacement,
    Double imageSpacing,
    String buttonShape,
    String shapeType,
    Double cornerRadius,
    GradientSpec gradient,
    PageIndicatorSpec pageIndicator,
    JsonValue.ObjectValue properties
) implements LayoutNode {
    public Component {
        data = data == null ? Map.of() : Map.copyOf(data);
        state = state == null ? Map.of() : Map.copyOf(state);
        properties = properties == null ? JsonValue.ObjectValue.EMPTY : properties;
    }

    @Override
    public String kind() {
        return type;
    }

    /** Style ids per interaction state, used by buttons. */
    public record StateStyles(String normal, String selected, String disabled) {}

    /** Exactly one source is expected; {@code sfsymbol} wins over the others. */
    public record ImageSpec(
        String sfsymbol,
        String asset,
        String url,
        String statePath,
        boolean activityIndicator,
        String placeholder
    ) {}

    public record GradientSpec(String type, List<ColorStop> colors, String start, String end) {
        public GradientSpec {
            colors = colors == null ? List.of() : List.copyOf(colors);
        }
    }

    /** A fixed {@code color}, or a {@code lightColor}/{@code darkColor} pair. */
    public record ColorStop(String color, String lightColor, String darkColor, Double location) {}

    /** {@code pageCount} is either a number or a state path string. */
    public record PageIndicatorSpec(
        String currentPage,
        JsonValue pageCount,
        Double dotSize,
        Double dotSpacing,
        String dotColor,
        String currentDotColor
    ) {}
}
