package work.lcod.scals.resolution;

import java.util.ArrayList;
import java.util.List;
import work.lcod.scals.action.ActionResolver;
import work.lcod.scals.document.DocumentDefinition;
import work.lcod.scals.ir.ResolutionError;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.style.StyleResolver;

/**
 * Collaborators shared by every node of one document session. Lives as long as the session so
 * that incremental passes resolve against the same styles and registries.
 */
final class ResolutionEnvironment {
    private final Resolver resolver;
    private final DocumentDefinition document;
    private final StateStore store;
    private final StyleResolver styles;
    private final DependencyTracker tracker;
    private final List<ResolutionError> errors = new ArrayList<>();

    ResolutionEnvironment(
        Resolver resolver,
        DocumentDefinition document,
        StateStore store,
        StyleResolver styles,
        DependencyTracker tracker
    ) {
        this.resolver = resolver;
        this.document = document;
        this.store = store;
        this.styles = styles;
        this.tracker = tracker;
    }

    Resolver resolver() {
        return resolver;
    }

    DocumentDefinition document() {
        return document;
    }

    StateStore store() {
        return store;
    }

    StyleResolver styles() {
        return styles;
    }

    ResolverRegistries registries() {
        return resolver.registries();
    }

    ActionResolver actionResolver() {
        return resolver.actionResolver();
    }

    /** {@code null} when tracking is disabled. */
    DependencyTracker tracker() {
        return tracker;
    }

    boolean isTracking() {
        return tracker != null;
    }

    void reportError(ResolutionError error) {
        errors.add(error);
    }

    /** Errors reported since the previous call. */
    List<ResolutionError> drainErrors() {
        var drained = List.copyOf(errors);
        errors.clear();
        return drained;
    }
}
