package work.lcod.scals.components;

import java.util.LinkedHashMap;
import work.lcod.scals.document.Component;
import work.lcod.scals.ir.CustomNode;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.resolution.ComponentResolver;
import work.lcod.scals.resolution.ComponentResolverRegistry;
import work.lcod.scals.resolution.NodeStyling;
import work.lcod.scals.resolution.ResolutionContext;
import work.lcod.scals.state.ExpressionEvaluator;
import work.lcod.scals.state.JsonValue;

/**
 * Passes a host-defined component kind through as a {@link CustomNode}. String properties that
 * hold {@code ${}} templates are interpolated; everything else is copied as written.
 *
 * <pre>{@code
 * CustomComponentResolver.register(registries.components(), "chart", "map");
 * }</pre>
 */
public final class CustomComponentResolver implements ComponentResolver {
    public static final CustomComponentResolver INSTANCE = new CustomComponentResolver();

    public static void register(ComponentResolverRegistry registry, String... kinds) {
        for (var kind : kinds) {
            registry.register(kind, INSTANCE);
        }
    }

    @Override
    public RenderNode resolve(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        var properties = new LinkedHashMap<String, JsonValue>();
        component.properties().fields().forEach((key, value) -> {
            var text = value.asString().orElse(null);
            if (text != null && ExpressionEvaluator.containsExpression(text)) {
                properties.put(key, ExpressionEvaluator.isPureExpression(text) ? context.evaluate(text) : JsonValue.of(context.interpolate(text)));
            } else {
                properties.put(key, value);
            }
        });
        return new CustomNode(
            context.nodeId(component.id()),
            component.styleId(),
            component.type(),
            JsonValue.object(properties),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.decoration(style),
            NodeStyling.frame(style)
        );
    }
}
