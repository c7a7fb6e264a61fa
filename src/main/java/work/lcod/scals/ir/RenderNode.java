package work.lcod.scals.ir;

import java.util.List;

/**
 * One fully resolved UI primitive. Renderers switch on the concrete type.
 */
public sealed interface RenderNode
    permits ContainerNode, TextNode, ButtonNode, ImageNode, TextFieldNode, ToggleNode, SliderNode,
        SpacerNode, DividerNode, GradientNode, ShapeNode, SectionLayoutNode, PageIndicatorNode, CustomNode {

    /** Document id, or a structural id such as {@code root.0.2} when the document gives none. */
    String id();

    String kind();

    /** Child nodes in render order; empty for leaves. */
    default List<RenderNode> children() {
        return List.of();
    }
}
