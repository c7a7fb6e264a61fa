package work.lcod.scals.resolution;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Layout resolvers keyed by document {@code type}.
 */
public final class LayoutResolverRegistry {
    private final Map<String, LayoutResolver> resolvers = new ConcurrentHashMap<>();

    public LayoutResolverRegistry register(String kind, LayoutResolver resolver) {
        resolvers.put(kind, resolver);
        return this;
    }

    public void unregister(String kind) {
        if (kind != null) {
            resolvers.remove(kind);
        }
    }

    public Optional<LayoutResolver> resolver(String kind) {
        return Optional.ofNullable(kind == null ? null : resolvers.get(kind));
    }

    public boolean hasResolver(String kind) {
        return kind != null && resolvers.containsKey(kind);
    }

    public Map<String, LayoutResolver> entries() {
        return Collections.unmodifiableMap(resolvers);
    }
}
