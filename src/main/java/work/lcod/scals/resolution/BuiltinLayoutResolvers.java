package work.lcod.scals.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.lcod.scals.document.ForEach;
import work.lcod.scals.document.Layout;
import work.lcod.scals.document.LayoutNode;
import work.lcod.scals.document.SectionLayout;
import work.lcod.scals.document.Spacer;
import work.lcod.scals.ir.Alignment;
import work.lcod.scals.ir.ContainerNode;
import work.lcod.scals.ir.Decoration;
import work.lcod.scals.ir.EdgeInsets;
import work.lcod.scals.ir.Frame;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.ir.SpacerNode;
import work.lcod.scals.state.JsonValue;

/**
 * Stacks, the {@code forEach} repeater, spacers and section layouts.
 */
public final class BuiltinLayoutResolvers {
    private BuiltinLayoutResolvers() {}

    public static void register(LayoutResolverRegistry registry) {
        registry.register(Layout.VSTACK, BuiltinLayoutResolvers::stack);
        registry.register(Layout.HSTACK, BuiltinLayoutResolvers::stack);
        registry.register(Layout.ZSTACK, BuiltinLayoutResolvers::stack);
        registry.register(ForEach.KIND, BuiltinLayoutResolvers::forEach);
        registry.register(Spacer.KIND, BuiltinLayoutResolvers::spacer);
        registry.register(SectionLayout.KIND, SectionLayoutResolver::resolve);
    }

    static RenderNode stack(LayoutNode node, ResolutionContext context) {
        var layout = expect(node, Layout.class);
        var style = context.style(layout.styleId(), layout.style());
        var children = context.withLocalState(layout.state()).resolveChildren(layout.children());
        return new ContainerNode(
            context.nodeId(null),
            ContainerNode.LayoutType.from(layout.type()),
            stackAlignment(layout.type(), layout.alignment()),
            layout.spacing() == null ? 0 : layout.spacing(),
            NodeStyling.padding(style, layout.padding()),
            NodeStyling.decoration(style),
            NodeStyling.frame(style),
            children
        );
    }

    /**
     * One template instance per array element, inside a container of its own. An empty or absent
     * array renders the empty view inside that container instead.
     */
    static RenderNode forEach(LayoutNode node, ResolutionContext context) {
        var forEach = expect(node, ForEach.class);
        var items = context.read(forEach.items()).asArray().orElse(List.of());
        var children = new ArrayList<RenderNode>(items.size());
        if (items.isEmpty()) {
            if (forEach.emptyView() != null) {
                var empty = context.resolveChild(forEach.emptyView(), "empty", ".emptyView");
                if (empty != null) {
                    children.add(empty);
                }
            }
        } else if (forEach.template() != null) {
            for (int i = 0; i < items.size(); i++) {
                var bindings = new LinkedHashMap<String, JsonValue>();
                bindings.put(forEach.indexVariable(), JsonValue.of((long) i));
                bindings.put(forEach.itemVariable(), items.get(i));
                var child = context.resolveChild(forEach.template(), String.valueOf(i), ".template", bindings);
                if (child != null) {
                    children.add(child);
                }
            }
        }
        return new ContainerNode(
            context.nodeId(null),
            ContainerNode.LayoutType.from(forEach.layout()),
            stackAlignment(forEach.layout(), forEach.alignment()),
            forEach.spacing() == null ? 0 : forEach.spacing(),
            forEach.padding() == null ? EdgeInsets.ZERO : forEach.padding().toEdgeInsets(),
            Decoration.NONE,
            Frame.NONE,
            children
        );
    }

    static RenderNode spacer(LayoutNode node, ResolutionContext context) {
        var spacer = expect(node, Spacer.class);
        return new SpacerNode(context.nodeId(null), spacer.minLength(), spacer.width(), spacer.height());
    }

    // A vstack aligns along the horizontal axis only, an hstack along the vertical one.
    static Alignment stackAlignment(String type, Alignment alignment) {
        if (alignment == null) {
            return Alignment.CENTER;
        }
        if (Layout.HSTACK.equals(type)) {
            return new Alignment(Alignment.Horizontal.CENTER, alignment.vertical());
        }
        if (Layout.ZSTACK.equals(type)) {
            return alignment;
        }
        return new Alignment(alignment.horizontal(), Alignment.Vertical.CENTER);
    }

    static <T extends LayoutNode> T expect(LayoutNode node, Class<T> type) {
        if (!type.isInstance(node)) {
            throw new ResolutionException("invalid_node",
                "Resolver for '" + node.kind() + "' expects " + type.getSimpleName() + " but got " + node.getClass().getSimpleName());
        }
        return type.cast(node);
    }
}
