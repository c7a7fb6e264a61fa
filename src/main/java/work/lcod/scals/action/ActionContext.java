package work.lcod.scals.action;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.document.ActionBinding;
import work.lcod.scals.document.DocumentAction;
import work.lcod.scals.state.StateStore;

/**
 * Runs actions for one document session: resolves them, looks up a handler and falls back to the
 * host delegate. Failures are logged and the returned future still completes normally.
 */
public final class ActionContext {
    private static final Logger log = LoggerFactory.getLogger(ActionContext.class);

    private final String sessionId;
    private final StateStore store;
    private final Map<String, DocumentAction> actions;
    private final ActionResolver resolver;
    private final ActionRegistry registry;
    private final ActionDelegate delegate;
    private final ActionPresenter presenter;

    public ActionContext(
        String sessionId,
        StateStore store,
        Map<String, DocumentAction> actions,
        ActionResolver resolver,
        ActionRegistry registry,
        ActionDelegate delegate,
        ActionPresenter presenter
    ) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.store = Objects.requireNonNull(store, "store");
        this.actions = actions == null ? Map.of() : Map.copyOf(actions);
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.delegate = delegate;
        this.presenter = presenter;
    }

    public String sessionId() {
        return sessionId;
    }

    public StateStore store() {
        return store;
    }

    public ActionPresenter presenter() {
        return presenter;
    }

    public ActionRegistry registry() {
        return registry;
    }

    /** Runs a document action by id under a fresh request id. */
    public CompletableFuture<Void> execute(String actionId) {
        return execute(actionId, UUID.randomUUID().toString());
    }

    /**
     * Runs a document action by id. The request can be cancelled through
     * {@link ActionRegistry#cancel(String, String)} until the returned future completes.
     */
    public CompletableFuture<Void> execute(String actionId, String requestId) {
        var action = actions.get(actionId);
        if (action == null) {
            log.warn("Unknown action '{}' in session {}", actionId, sessionId);
            return CompletableFuture.completedFuture(null);
        }
        var token = registry.track(sessionId, requestId);
        return execute(action, token).whenComplete((ignored, error) -> registry.release(sessionId, requestId));
    }

    public CompletableFuture<Void> execute(ActionBinding binding) {
        if (binding == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (binding.isReference()) {
            return execute(binding.reference());
        }
        var requestId = UUID.randomUUID().toString();
        var token = registry.track(sessionId, requestId);
        return execute(binding.inline(), token).whenComplete((ignored, error) -> registry.release(sessionId, requestId));
    }

    /**
     * Resolves {@code action} now, against the current state, and runs it.
     */
    public CompletableFuture<Void> execute(DocumentAction action, CancellationToken token) {
        if (token.isCancelled()) {
            log.debug("Skipping cancelled action '{}'", action.type());
            return CompletableFuture.completedFuture(null);
        }
        ActionDefinition definition;
        try {
            definition = resolver.resolve(action);
        } catch (ActionResolutionException ex) {
            log.warn("Ignoring action: {}", ex.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return execute(definition, token);
    }

    public CompletableFuture<Void> execute(ActionDefinition definition, CancellationToken token) {
        if (token.isCancelled()) {
            log.debug("Skipping cancelled action '{}'", definition.kind());
            return CompletableFuture.completedFuture(null);
        }
        var handler = registry.handler(definition.kind()).orElse(null);
        if (handler == null) {
            if (delegate != null && delegate.handleAction(definition, this)) {
                return CompletableFuture.completedFuture(null);
            }
            log.warn("No handler registered for action kind '{}'", definition.kind());
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> result;
        try {
            result = handler.execute(definition, this, token);
        } catch (Exception ex) {
            log.warn("Action '{}' failed: {}", definition.kind(), ex.getMessage(), ex);
            return CompletableFuture.completedFuture(null);
        }
        if (result == null) {
            return CompletableFuture.completedFuture(null);
        }
        return result.exceptionally(error -> {
            var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.warn("Action '{}' failed: {}", definition.kind(), cause.getMessage(), cause);
            return null;
        });
    }
}
