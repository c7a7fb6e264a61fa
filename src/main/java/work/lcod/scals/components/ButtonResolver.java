package work.lcod.scals.components;

import work.lcod.scals.document.Component;
import work.lcod.scals.ir.ButtonNode;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.resolution.ContentResolver;
import work.lcod.scals.resolution.NodeStyling;
import work.lcod.scals.resolution.ResolutionContext;
import work.lcod.scals.state.ExpressionEvaluator;
import work.lcod.scals.style.ResolvedStyle;

/**
 * Buttons carry one resolved appearance per interaction state. The normal state falls back to
 * {@code styleId} when {@code styles.normal} is absent; the inline style applies to it only.
 */
final class ButtonResolver {
    static final double DEFAULT_IMAGE_SPACING = 8;

    private ButtonResolver() {}

    static RenderNode resolve(Component component, ResolutionContext context) {
        var stateStyles = component.styles();
        var normalId = stateStyles != null && stateStyles.normal() != null ? stateStyles.normal() : component.styleId();
        var normal = stateStyle(context.style(normalId, component.style()), component);
        var selected = stateStyles == null || stateStyles.selected() == null
            ? null
            : stateStyle(context.style(stateStyles.selected()), component);
        var disabled = stateStyles == null || stateStyles.disabled() == null
            ? null
            : stateStyle(context.style(stateStyles.disabled()), component);

        var label = component.text() != null
            ? ContentResolver.resolveText(component.text(), context).text()
            : ContentResolver.resolve(component, context).text();
        var isSelected = component.isSelectedBinding() != null
            && ExpressionEvaluator.evaluateCondition(component.isSelectedBinding(), context);

        return new ButtonNode(
            context.nodeId(component.id()),
            normalId,
            label,
            new ButtonNode.Styles(normal, selected, disabled),
            component.isSelectedBinding(),
            isSelected,
            component.fillWidth(),
            context.action(component.onTap()),
            ImageResolver.source(component.image(), context),
            ButtonNode.ImagePlacement.from(component.imagePlacement()),
            component.imageSpacing() == null ? DEFAULT_IMAGE_SPACING : component.imageSpacing(),
            ButtonNode.ButtonShape.from(component.buttonShape())
        );
    }

    private static ButtonNode.StateStyle stateStyle(ResolvedStyle style, Component component) {
        return new ButtonNode.StateStyle(
            NodeStyling.textStyle(style),
            NodeStyling.decoration(style),
            style.tintColor(),
            NodeStyling.padding(style, component.padding()),
            NodeStyling.frame(style)
        );
    }
}
