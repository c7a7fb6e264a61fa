package work.lcod.scals.action;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.state.ExpressionEvaluator;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.JsonValues;

/**
 * Execution of the built-in action kinds.
 */
public final class BuiltinActionHandlers {
    private static final Logger log = LoggerFactory.getLogger(BuiltinActionHandlers.class);
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private BuiltinActionHandlers() {}

    public static ActionRegistry register(ActionRegistry registry) {
        registry.register("dismiss", BuiltinActionHandlers::dismiss);
        registry.register("setState", BuiltinActionHandlers::setState);
        registry.register("toggleState", BuiltinActionHandlers::toggleState);
        registry.register("showAlert", BuiltinActionHandlers::showAlert);
        registry.register("navigate", BuiltinActionHandlers::navigate);
        registry.register("openURL", BuiltinActionHandlers::openUrl);
        registry.register("sequence", BuiltinActionHandlers::sequence);
        registry.register("appendToArray", BuiltinActionHandlers::appendToArray);
        registry.register("removeFromArray", BuiltinActionHandlers::removeFromArray);
        registry.register("toggleInArray", BuiltinActionHandlers::toggleInArray);
        registry.register("setArrayItem", BuiltinActionHandlers::setArrayItem);
        registry.register("clearArray", BuiltinActionHandlers::clearArray);
        return registry;
    }

    private static CompletableFuture<Void> dismiss(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var presenter = ctx.presenter();
        if (presenter == null) {
            log.warn("dismiss requested but no presenter is attached to session {}", ctx.sessionId());
        } else {
            presenter.dismiss();
        }
        return DONE;
    }

    private static CompletableFuture<Void> setState(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.SetState.class);
        ctx.store().set(params.path(), params.value().evaluate(ctx.store()));
        return DONE;
    }

    private static CompletableFuture<Void> toggleState(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var path = definition.parameters(ActionParameters.ToggleState.class).path();
        var current = ctx.store().get(path).asBoolean().orElse(false);
        ctx.store().set(path, JsonValue.of(!current));
        return DONE;
    }

    private static CompletableFuture<Void> showAlert(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.ShowAlert.class);
        var presenter = ctx.presenter();
        if (presenter == null) {
            log.warn("showAlert requested but no presenter is attached to session {}", ctx.sessionId());
            return DONE;
        }
        var message = params.messageIsTemplate()
            ? ExpressionEvaluator.interpolate(params.message(), ctx.store())
            : params.message();
        var buttons = params.buttons().isEmpty()
            ? List.of(new ActionParameters.AlertButton("OK", ActionParameters.AlertButtonStyle.DEFAULT, null))
            : params.buttons();
        presenter.presentAlert(new AlertConfiguration(params.title(), message, buttons, actionId -> {
            if (actionId != null) {
                ctx.execute(actionId);
            }
        }));
        return DONE;
    }

    private static CompletableFuture<Void> navigate(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.Navigate.class);
        var presenter = ctx.presenter();
        if (presenter == null) {
            log.warn("navigate to '{}' requested but no presenter is attached to session {}",
                params.destination(), ctx.sessionId());
        } else {
            presenter.navigate(params.destination(), params.presentation());
        }
        return DONE;
    }

    private static CompletableFuture<Void> openUrl(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var url = definition.parameters(ActionParameters.OpenUrl.class).url();
        var presenter = ctx.presenter();
        if (presenter == null) {
            log.warn("openURL '{}' requested but no presenter is attached to session {}", url, ctx.sessionId());
        } else {
            presenter.openUrl(url);
        }
        return DONE;
    }

    // Each step is resolved only once the previous one has completed.
    private static CompletableFuture<Void> sequence(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var steps = definition.parameters(ActionParameters.Sequence.class).steps();
        CompletableFuture<Void> chain = DONE;
        for (var step : steps) {
            chain = chain.thenCompose(ignored -> {
                if (token.isCancelled()) {
                    log.debug("Sequence cancelled before step '{}'", step.type());
                    return DONE;
                }
                return ctx.execute(step, token);
            });
        }
        return chain;
    }

    private static CompletableFuture<Void> appendToArray(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.AppendToArray.class);
        ctx.store().append(params.path(), params.value().evaluate(ctx.store()));
        return DONE;
    }

    private static CompletableFuture<Void> removeFromArray(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.RemoveFromArray.class);
        if (params.index() != null) {
            ctx.store().removeAt(params.path(), params.index());
        } else {
            ctx.store().removeByValue(params.path(), params.value().evaluate(ctx.store()));
        }
        return DONE;
    }

    private static CompletableFuture<Void> toggleInArray(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.ToggleInArray.class);
        ctx.store().toggleMembership(params.path(), params.value().evaluate(ctx.store()));
        return DONE;
    }

    private static CompletableFuture<Void> setArrayItem(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        var params = definition.parameters(ActionParameters.SetArrayItem.class);
        var current = ctx.store().get(params.path());
        var size = current.asArray().map(List::size).orElse(0);
        if (params.index() < 0 || params.index() >= size) {
            log.debug("setArrayItem index {} outside '{}' ({} items): {}",
                params.index(), params.path(), size, JsonValues.toJsonString(current));
            return DONE;
        }
        ctx.store().setArrayItem(params.path(), params.index(), params.value().evaluate(ctx.store()));
        return DONE;
    }

    private static CompletableFuture<Void> clearArray(ActionDefinition definition, ActionContext ctx, CancellationToken token) {
        ctx.store().clearArray(definition.parameters(ActionParameters.ClearArray.class).path());
        return DONE;
    }
}
