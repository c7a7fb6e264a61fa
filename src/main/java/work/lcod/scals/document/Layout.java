package work.lcod.scals.document;

import java.util.List;
import java.util.Map;
import work.lcod.scals.ir.Alignment;
import work.lcod.scals.state.JsonValue;

/**
 * Stack container ({@code vstack}, {@code hstack} or {@code zstack}).
 */
public record Layout(
    String type,
    Alignment alignment,
    Double spacing,
    Padding padding,
    String styleId,
    Style style,
    Map<String, JsonValue> state,
    List<LayoutNode> children
) implements LayoutNode {
    public static final String VSTACK = "vstack";
    public static final String HSTACK = "hstack";
    public static final String ZSTACK = "zstack";

    public Layout {
        children = children == null ? List.of() : List.copyOf(children);
        state = state == null ? Map.of() : Map.copyOf(state);
    }

    @Override
    public String kind() {
        return type;
    }
}
