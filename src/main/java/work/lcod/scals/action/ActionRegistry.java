package work.lcod.scals.action;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution-time handlers keyed by action type, plus the cancellation tokens of in-flight
 * requests keyed by session id and request id.
 */
public final class ActionRegistry {
    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, Map<String, CancellationToken>> inFlight = new ConcurrentHashMap<>();

    public static ActionRegistry defaults() {
        var registry = new ActionRegistry();
        BuiltinActionHandlers.register(registry);
        return registry;
    }

    public ActionRegistry register(String type, ActionHandler handler) {
        handlers.put(type, handler);
        return this;
    }

    public void unregister(String type) {
        if (type != null) {
            handlers.remove(type);
        }
    }

    public Optional<ActionHandler> handler(ActionKind kind) {
        return Optional.ofNullable(handlers.get(kind.name()));
    }

    public boolean hasHandler(String type) {
        return handlers.containsKey(type);
    }

    public Map<String, ActionHandler> handlers() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Token for one request. Repeated calls with the same ids share the token until it is released.
     */
    public CancellationToken track(String sessionId, String requestId) {
        return inFlight.computeIfAbsent(sessionId, ignored -> new ConcurrentHashMap<>())
            .computeIfAbsent(requestId, ignored -> new CancellationToken());
    }

    public void release(String sessionId, String requestId) {
        inFlight.computeIfPresent(sessionId, (session, requests) -> {
            requests.remove(requestId);
            return requests.isEmpty() ? null : requests;
        });
    }

    /**
     * Best effort: later effects of the request are suppressed, state already written stays.
     *
     * @return whether a request with these ids was in flight
     */
    public boolean cancel(String sessionId, String requestId) {
        var requests = inFlight.get(sessionId);
        var token = requests == null ? null : requests.remove(requestId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public int cancelAll(String sessionId) {
        var requests = inFlight.remove(sessionId);
        if (requests == null) {
            return 0;
        }
        requests.values().forEach(CancellationToken::cancel);
        return requests.size();
    }
}
