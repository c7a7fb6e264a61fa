package work.lcod.scals.resolution;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Component resolvers keyed by component {@code type}. Built-in and host-defined kinds share the
 * same namespace; registering an existing kind replaces it.
 */
public final class ComponentResolverRegistry {
    private final Map<String, ComponentResolver> resolvers = new ConcurrentHashMap<>();

    public ComponentResolverRegistry register(String kind, ComponentResolver resolver) {
        resolvers.put(kind, resolver);
        return this;
    }

    public void unregister(String kind) {
        if (kind != null) {
            resolvers.remove(kind);
        }
    }

    public Optional<ComponentResolver> resolver(String kind) {
        return Optional.ofNullable(kind == null ? null : resolvers.get(kind));
    }

    public boolean hasResolver(String kind) {
        return kind != null && resolvers.containsKey(kind);
    }

    public Map<String, ComponentResolver> entries() {
        return Collections.unmodifiableMap(resolvers);
    }
}
