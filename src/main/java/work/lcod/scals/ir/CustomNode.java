package work.lcod.scals.ir;

import work.lcod.scals.state.JsonValue;

/**
 * Placeholder for a host-defined component kind. The host's renderer interprets {@code properties}.
 */
public record CustomNode(
    String id,
    String styleId,
    String componentKind,
    JsonValue.ObjectValue properties,
    EdgeInsets padding,
    Decoration decoration,
    Frame frame
) implements RenderNode {
    public static final String KIND = "custom";

    @Override
    public String kind() {
        return KIND;
    }
}
