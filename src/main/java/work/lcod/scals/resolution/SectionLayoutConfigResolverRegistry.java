package work.lcod.scals.resolution;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Section arrangement resolvers keyed by section layout {@code type} ({@code list}, {@code grid}...).
 */
public final class SectionLayoutConfigResolverRegistry {
    private final Map<String, SectionLayoutConfigResolver> resolvers = new ConcurrentHashMap<>();

    public SectionLayoutConfigResolverRegistry register(String kind, SectionLayoutConfigResolver resolver) {
        resolvers.put(kind, resolver);
        return this;
    }

    public void unregister(String kind) {
        if (kind != null) {
            resolvers.remove(kind);
        }
    }

    public Optional<SectionLayoutConfigResolver> resolver(String kind) {
        return Optional.ofNullable(kind == null ? null : resolvers.get(kind));
    }

    public boolean hasResolver(String kind) {
        return kind != null && resolvers.containsKey(kind);
    }

    public Map<String, SectionLayoutConfigResolver> entries() {
        return Collections.unmodifiableMap(resolvers);
    }
}
