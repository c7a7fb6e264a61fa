package work.lcod.scals.components;

import java.util.ArrayList;
import java.util.List;
import work.lcod.scals.document.Component;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.Dimension;
import work.lcod.scals.ir.DividerNode;
import work.lcod.scals.ir.GradientNode;
import work.lcod.scals.ir.PageIndicatorNode;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.ir.ShapeNode;
import work.lcod.scals.ir.SliderNode;
import work.lcod.scals.ir.TextFieldNode;
import work.lcod.scals.ir.TextNode;
import work.lcod.scals.ir.ToggleNode;
import work.lcod.scals.ir.UnitPoint;
import work.lcod.scals.resolution.ComponentResolverRegistry;
import work.lcod.scals.resolution.ContentResolver;
import work.lcod.scals.resolution.NodeStyling;
import work.lcod.scals.resolution.ResolutionContext;
import work.lcod.scals.resolution.ResolutionException;
import work.lcod.scals.state.ExpressionEvaluator;
import work.lcod.scals.state.JsonValue;

/**
 * Resolvers for the built-in component kinds. Buttons and images live in their own classes.
 */
public final class BuiltinComponentResolvers {
    static final Color DEFAULT_TINT = Color.parse("#007AFF");
    static final Color DIVIDER_GRAY = new Color(0.8, 0.8, 0.8, 1);

    private BuiltinComponentResolvers() {}

    public static void register(ComponentResolverRegistry registry) {
        registry.register("label", BuiltinComponentResolvers::text);
        registry.register("text", BuiltinComponentResolvers::text);
        registry.register("button", ButtonResolver::resolve);
        registry.register("image", ImageResolver::resolve);
        registry.register("textfield", BuiltinComponentResolvers::textField);
        registry.register("toggle", BuiltinComponentResolvers::toggle);
        registry.register("slider", BuiltinComponentResolvers::slider);
        registry.register("divider", BuiltinComponentResolvers::divider);
        registry.register("gradient", BuiltinComponentResolvers::gradient);
        registry.register("shape", BuiltinComponentResolvers::shape);
        registry.register("pageIndicator", BuiltinComponentResolvers::pageIndicator);
    }

    static RenderNode text(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        var content = ContentResolver.resolve(component, context);
        return new TextNode(
            context.nodeId(component.id()),
            component.styleId(),
            content.text(),
            content.bindingPath(),
            content.bindingTemplate(),
            NodeStyling.textStyle(style),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.decoration(style),
            NodeStyling.frame(style)
        );
    }

    static RenderNode textField(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        var path = component.bind();
        String value = "";
        if (path != null) {
            context.recordWrite(path);
            value = context.read(path).displayString();
        }
        return new TextFieldNode(
            context.nodeId(component.id()),
            component.styleId(),
            component.placeholder() == null ? "" : component.placeholder(),
            path,
            value,
            NodeStyling.textStyle(style),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.decoration(style),
            NodeStyling.frame(style)
        );
    }

    static RenderNode toggle(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        var path = component.bind();
        boolean on = false;
        if (path != null) {
            context.recordWrite(path);
            on = context.read(path).asBoolean().orElse(false);
        }
        return new ToggleNode(
            context.nodeId(component.id()),
            component.styleId(),
            path,
            on,
            NodeStyling.tint(style, DEFAULT_TINT),
            context.action(component.onValueChanged()),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.frame(style)
        );
    }

    static RenderNode slider(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        double min = component.minValue() == null ? 0 : component.minValue();
        double max = component.maxValue() == null ? 1 : component.maxValue();
        if (max < min) {
            throw new ResolutionException("invalid_range", "Slider maxValue " + max + " is below minValue " + min);
        }
        var path = component.bind();
        double value = min;
        if (path != null) {
            context.recordWrite(path);
            value = context.read(path).asDouble().orElse(min);
        }
        return new SliderNode(
            context.nodeId(component.id()),
            component.styleId(),
            path,
            Math.max(min, Math.min(max, value)),
            min,
            max,
            NodeStyling.tint(style, DEFAULT_TINT),
            context.action(component.onValueChanged()),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.frame(style)
        );
    }

    // Background color is the line color; an absolute height is the thickness.
    static RenderNode divider(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        var height = style.height();
        return new DividerNode(
            context.nodeId(component.id()),
            style.backgroundColor() == null ? DIVIDER_GRAY : style.backgroundColor(),
            height != null && height.kind() == Dimension.Kind.ABSOLUTE ? height.value() : 1,
            NodeStyling.padding(style, component.padding())
        );
    }

    static RenderNode gradient(Component component, ResolutionContext context) {
        var spec = component.gradient();
        if (spec == null || spec.colors().isEmpty()) {
            throw new ResolutionException("missing_field", "Gradient requires gradientColors");
        }
        var style = context.style(component.styleId(), component.style());
        var stops = new ArrayList<GradientNode.ColorStop>(spec.colors().size());
        int count = spec.colors().size();
        for (int i = 0; i < count; i++) {
            var stop = spec.colors().get(i);
            double location = stop.location() != null ? stop.location() : (count == 1 ? 0 : (double) i / (count - 1));
            stops.add(new GradientNode.ColorStop(gradientColor(stop), location));
        }
        return new GradientNode(
            context.nodeId(component.id()),
            GradientNode.GradientType.from(spec.type()),
            stops,
            UnitPoint.named(spec.start(), UnitPoint.BOTTOM),
            UnitPoint.named(spec.end(), UnitPoint.TOP),
            style.cornerRadius() == null ? 0 : style.cornerRadius(),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.frame(style)
        );
    }

    private static GradientNode.GradientColor gradientColor(Component.ColorStop stop) {
        if (stop.lightColor() != null || stop.darkColor() != null) {
            var light = Color.parse(stop.lightColor() != null ? stop.lightColor() : stop.darkColor());
            var dark = Color.parse(stop.darkColor() != null ? stop.darkColor() : stop.lightColor());
            return new GradientNode.GradientColor(light, dark);
        }
        return GradientNode.GradientColor.fixed(Color.parse(stop.color()));
    }

    static RenderNode shape(Component component, ResolutionContext context) {
        if (component.shapeType() == null) {
            throw new ResolutionException("missing_field", "Shape requires shapeType");
        }
        var style = context.style(component.styleId(), component.style());
        var type = ShapeNode.ShapeType.from(component.shapeType());
        double radius = component.cornerRadius() != null
            ? component.cornerRadius()
            : style.cornerRadius() == null ? 0 : style.cornerRadius();
        return new ShapeNode(
            context.nodeId(component.id()),
            type,
            type == ShapeNode.ShapeType.ROUNDED_RECTANGLE ? radius : 0,
            style.backgroundColor() == null ? Color.CLEAR : style.backgroundColor(),
            style.borderColor(),
            style.borderWidth() == null ? 0 : style.borderWidth(),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.frame(style)
        );
    }

    /**
     * {@code currentPage} is a state path. {@code pageCount} is a number, a state path, or a
     * {@code ${path.count}} style expression; it defaults to 5.
     */
    static RenderNode pageIndicator(Component component, ResolutionContext context) {
        var spec = component.pageIndicator();
        if (spec == null || spec.currentPage() == null) {
            throw new ResolutionException("missing_field", "pageIndicator requires currentPage");
        }
        var style = context.style(component.styleId(), component.style());
        int current = context.read(spec.currentPage()).asDouble().map(Double::intValue).orElse(0);
        return new PageIndicatorNode(
            context.nodeId(component.id()),
            spec.currentPage(),
            current,
            pageCount(spec.pageCount(), context),
            spec.dotSize() == null ? 8 : spec.dotSize(),
            spec.dotSpacing() == null ? 8 : spec.dotSpacing(),
            Color.parse(spec.dotColor() == null ? "#CCCCCC" : spec.dotColor()),
            Color.parse(spec.currentDotColor() == null ? "#007AFF" : spec.currentDotColor()),
            NodeStyling.padding(style, component.padding())
        );
    }

    private static int pageCount(JsonValue raw, ResolutionContext context) {
        if (raw == null || raw.isNull()) {
            return 5;
        }
        var number = raw.asDouble();
        if (number.isPresent()) {
            return number.get().intValue();
        }
        var text = raw.asString().orElse(null);
        if (text == null) {
            return 5;
        }
        var value = ExpressionEvaluator.containsExpression(text) ? context.evaluate(text) : context.read(text);
        var count = value.asDouble();
        if (count.isPresent()) {
            return count.get().intValue();
        }
        return value.asArray().map(List::size).orElse(0);
    }
}
