package work.lcod.scals.components;

import work.lcod.scals.document.Component;
import work.lcod.scals.document.DataReference;
import work.lcod.scals.ir.ImageNode;
import work.lcod.scals.ir.ImageSource;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.resolution.NodeStyling;
import work.lcod.scals.resolution.ResolutionContext;
import work.lcod.scals.state.ExpressionEvaluator;

final class ImageResolver {
    static final String FALLBACK_SYMBOL = "questionmark";

    private ImageResolver() {}

    static RenderNode resolve(Component component, ResolutionContext context) {
        var style = context.style(component.styleId(), component.style());
        var source = source(component.image(), context);
        if (source == null) {
            source = fromData(component, context);
        }
        var spec = component.image();
        return new ImageNode(
            context.nodeId(component.id()),
            component.styleId(),
            source,
            spec == null || spec.placeholder() == null ? null : ImageSource.sfSymbol(spec.placeholder()),
            source.type() == ImageSource.Type.URL || source.type() == ImageSource.Type.STATE_PATH
                ? ImageSource.ACTIVITY_INDICATOR
                : null,
            context.action(component.onTap()),
            style.tintColor(),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.decoration(style),
            NodeStyling.frame(style)
        );
    }

    /**
     * Source order: symbol, asset, activity indicator, state path, url. A url holding a
     * {@code ${}} template is read from state at render time. {@code null} when none is set.
     */
    static ImageSource source(Component.ImageSpec spec, ResolutionContext context) {
        if (spec == null) {
            return null;
        }
        if (spec.sfsymbol() != null) {
            return ImageSource.sfSymbol(spec.sfsymbol());
        }
        if (spec.asset() != null) {
            return ImageSource.asset(spec.asset());
        }
        if (spec.activityIndicator()) {
            return ImageSource.ACTIVITY_INDICATOR;
        }
        if (spec.statePath() != null) {
            context.read(spec.statePath());
            return ImageSource.statePath(spec.statePath());
        }
        if (spec.url() != null) {
            if (ExpressionEvaluator.containsExpression(spec.url())) {
                return ImageSource.url(context.interpolate(spec.url()));
            }
            return ImageSource.url(spec.url());
        }
        return null;
    }

    private static ImageSource fromData(Component component, ResolutionContext context) {
        var reference = component.data().get("value");
        if (reference == null) {
            return ImageSource.sfSymbol(FALLBACK_SYMBOL);
        }
        if (reference.type() == DataReference.Type.STATIC && reference.value() != null) {
            return ImageSource.sfSymbol(reference.value());
        }
        if (reference.type() == DataReference.Type.BINDING && reference.path() != null) {
            var name = context.read(reference.path()).asString().orElse(FALLBACK_SYMBOL);
            return ImageSource.sfSymbol(name);
        }
        if (reference.template() != null) {
            return ImageSource.sfSymbol(context.interpolate(reference.template()));
        }
        return ImageSource.sfSymbol(FALLBACK_SYMBOL);
    }
}
