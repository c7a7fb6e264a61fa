package work.lcod.scals.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.scals.document.DocumentAction;

/**
 * Kind-keyed registry of {@link ActionKindResolver}s. Kinds without a resolver pass through as
 * {@link ActionParameters.Custom} with their raw parameters.
 */
public final class ActionResolver {
    private final Map<String, ActionKindResolver> resolvers = new ConcurrentHashMap<>();

    public static ActionResolver defaults() {
        var resolver = new ActionResolver();
        BuiltinActionResolvers.register(resolver);
        return resolver;
    }

    public ActionResolver register(String type, ActionKindResolver resolver) {
        resolvers.put(type, resolver);
        return this;
    }

    public boolean hasResolver(String type) {
        return resolvers.containsKey(type);
    }

    /**
     * @throws ActionResolutionException when a required parameter is missing or mistyped
     */
    public ActionDefinition resolve(DocumentAction action) {
        var resolver = resolvers.get(action.type());
        if (resolver == null) {
            return new ActionDefinition(ActionKind.of(action.type()), new ActionParameters.Custom(action.parameters()));
        }
        return resolver.resolve(action);
    }

    public Map<String, ActionDefinition> resolveAll(Map<String, DocumentAction> actions) {
        var resolved = new LinkedHashMap<String, ActionDefinition>();
        if (actions != null) {
            actions.forEach((id, action) -> resolved.put(id, resolve(action)));
        }
        return resolved;
    }
}
