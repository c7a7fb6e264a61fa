package work.lcod.scals.ir;

import java.util.List;

public record ContainerNode(
    String id,
    LayoutType layoutType,
    Alignment alignment,
    double spacing,
    EdgeInsets padding,
    Decoration decoration,
    Frame frame,
    List<RenderNode> children
) implements RenderNode {
    public static final String KIND = "container";

    public enum LayoutType {
        VSTACK, HSTACK, ZSTACK;

        public static LayoutType from(String type) {
            if ("hstack".equals(type)) return HSTACK;
            if ("zstack".equals(type)) return ZSTACK;
            return VSTACK;
        }
    }

    public ContainerNode {
        children = List.copyOf(children);
    }

    @Override
    public String kind() {
        return KIND;
    }

    public ContainerNode withChildren(List<RenderNode> newChildren) {
        return new ContainerNode(id, layoutType, alignment, spacing, padding, decoration, frame, newChildren);
    }
}
