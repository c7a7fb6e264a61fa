package work.lcod.scals.resolution;

import work.lcod.scals.document.Component;
import work.lcod.scals.document.DataReference;
import work.lcod.scals.state.ExpressionEvaluator;

/**
 * Resolves the text content of a component. Sources are tried in order: the document data
 * source named by {@code dataSourceId}, the inline {@code data.value} reference, then
 * {@code text}, which may itself be a template.
 */
public final class ContentResolver {
    private ContentResolver() {}

    /**
     * @param bindingPath state path the content was read from, when bound to one path
     * @param bindingTemplate template the content was interpolated from
     */
    public record Content(String text, String bindingPath, String bindingTemplate) {
        public static Content fixed(String text) {
            return new Content(text == null ? "" : text, null, null);
        }

        public boolean isDynamic() {
            return bindingPath != null || bindingTemplate != null;
        }
    }

    public static Content resolve(Component component, ResolutionContext context) {
        var dataSource = context.dataSource(component.dataSourceId());
        if (dataSource != null) {
            return resolve(dataSource, context);
        }
        var inline = component.data().get("value");
        if (inline != null) {
            return resolve(inline, context);
        }
        return resolveText(component.text(), context);
    }

    public static Content resolveText(String text, ResolutionContext context) {
        if (ExpressionEvaluator.containsExpression(text)) {
            return new Content(context.interpolate(text), null, text);
        }
        return Content.fixed(text);
    }

    public static Content resolve(DataReference reference, ResolutionContext context) {
        switch (reference.type()) {
            case STATIC:
                return Content.fixed(reference.value());
            case LOCAL_BINDING:
                return reference.path() == null
                    ? Content.fixed("")
                    : Content.fixed(context.readLocal(reference.path()).displayString());
            default:
                if (reference.path() != null) {
                    return new Content(context.read(reference.path()).displayString(), reference.path(), null);
                }
                if (reference.template() != null) {
                    return new Content(context.interpolate(reference.template()), null, reference.template());
                }
                return Content.fixed("");
        }
    }
}
