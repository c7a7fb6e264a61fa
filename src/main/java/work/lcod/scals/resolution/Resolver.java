package work.lcod.scals.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.action.ActionDefinition;
import work.lcod.scals.action.ActionResolutionException;
import work.lcod.scals.action.ActionResolver;
import work.lcod.scals.document.Component;
import work.lcod.scals.document.DocumentDefinition;
import work.lcod.scals.document.LayoutNode;
import work.lcod.scals.document.RootComponent;
import work.lcod.scals.ir.Color;
import work.lcod.scals.ir.ColorScheme;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.ResolutionError;
import work.lcod.scals.ir.RootNode;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.style.DesignSystemProvider;
import work.lcod.scals.style.ResolvedStyle;
import work.lcod.scals.style.StyleCycleException;
import work.lcod.scals.style.StyleResolver;

/**
 * Resolves a document into a {@link RenderTree}, dispatching every node through the registries.
 *
 * <p>A node whose resolver throws is left out of the tree and reported in {@link RenderTree#errors()};
 * its siblings still resolve. Resolving the same document against the same state twice yields
 * equal trees.
 */
public final class Resolver {
    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    public static final double DEFAULT_SECTION_ITEM_SPACING = 8;

    private final ResolverRegistries registries;
    private final ActionResolver actionResolver;
    private final DesignSystemProvider designSystem;
    private final boolean trackingEnabled;
    private final double defaultSectionItemSpacing;
    private final Map<String, AtomicInteger> resolutionCounts = new ConcurrentHashMap<>();

    public Resolver() {
        this(ResolverRegistries.defaults(), ActionResolver.defaults(), null, true, DEFAULT_SECTION_ITEM_SPACING);
    }

    public Resolver(
        ResolverRegistries registries,
        ActionResolver actionResolver,
        DesignSystemProvider designSystem,
        boolean trackingEnabled,
        double defaultSectionItemSpacing
    ) {
        this.registries = Objects.requireNonNull(registries, "registries");
        this.actionResolver = Objects.requireNonNull(actionResolver, "actionResolver");
        this.designSystem = designSystem;
        this.trackingEnabled = trackingEnabled;
        this.defaultSectionItemSpacing = defaultSectionItemSpacing;
    }

    public ResolverRegistries registries() {
        return registries;
    }

    public ActionResolver actionResolver() {
        return actionResolver;
    }

    public boolean trackingEnabled() {
        return trackingEnabled;
    }

    public double defaultSectionItemSpacing() {
        return defaultSectionItemSpacing;
    }

    /**
     * Resolves {@code document} against the current content of {@code store}. The store is not
     * initialized from the document's declared state; callers do that once per session.
     */
    public ResolutionResult resolve(DocumentDefinition document, StateStore store) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(store, "store");
        var environment = new ResolutionEnvironment(
            this,
            document,
            store,
            new StyleResolver(document.styles(), designSystem),
            trackingEnabled ? new DependencyTracker() : null
        );
        var actions = resolveActions(document, environment);
        var viewRoot = trackingEnabled ? ViewNode.root() : null;
        var root = resolveRoot(document.root(), environment, viewRoot);
        var tree = new RenderTree(RenderTree.IR_VERSION, root, actions, environment.drainErrors());
        log.debug("Resolved document '{}' ({} root children, {} errors)", document.id(), root.children().size(), tree.errors().size());
        return new ResolutionResult(tree, viewRoot, environment);
    }

    /** Number of times the node with this id has been resolved by this resolver. */
    public int resolutionCount(String nodeId) {
        var count = resolutionCounts.get(nodeId);
        return count == null ? 0 : count.get();
    }

    public void resetResolutionCounts() {
        resolutionCounts.clear();
    }

    RenderNode resolveNode(LayoutNode node, ResolutionScope scope, ViewNode parent, ResolutionEnvironment environment) {
        var resolved = resolveTracked(node, scope, environment);
        if (resolved == null) {
            return null;
        }
        if (parent != null && resolved.view() != null) {
            parent.attach(resolved.view());
        }
        return resolved.node();
    }

    /**
     * Resolves one node inside its own tracking bracket. The returned view is not attached to a
     * parent yet.
     */
    Resolved resolveTracked(LayoutNode node, ResolutionScope scope, ResolutionEnvironment environment) {
        var view = environment.isTracking() ? new ViewNode(scope.structuralId(), node, scope) : null;
        if (view != null) {
            environment.tracker().begin(view);
        }
        try {
            var rendered = dispatch(node, new ResolutionContext(environment, scope, view));
            resolutionCounts.computeIfAbsent(rendered.id(), id -> new AtomicInteger()).incrementAndGet();
            return new Resolved(rendered, view);
        } catch (ResolutionException ex) {
            log.warn("Skipping {} '{}' at {}: {}", node.kind(), scope.structuralId(), scope.documentPath(), ex.getMessage());
            environment.reportError(new ResolutionError(scope.documentPath(), ex.code(), ex.getMessage()));
            return null;
        } catch (RuntimeException ex) {
            log.error("Resolver for {} '{}' at {} failed", node.kind(), scope.structuralId(), scope.documentPath(), ex);
            environment.reportError(new ResolutionError(scope.documentPath(), "resolution_failed", String.valueOf(ex.getMessage())));
            return null;
        } finally {
            if (view != null) {
                environment.tracker().end();
            }
        }
    }

    private RenderNode dispatch(LayoutNode node, ResolutionContext context) {
        if (node instanceof Component component) {
            var resolver = registries.components().resolver(component.type())
                .orElseThrow(() -> new UnknownKindException("component", component.type()));
            return resolver.resolve(component, context.withLocalState(component.state()));
        }
        var resolver = registries.layouts().resolver(node.kind())
            .orElseThrow(() -> new UnknownKindException("layout", node.kind()));
        return resolver.resolve(node, context);
    }

    private Map<String, ActionDefinition> resolveActions(DocumentDefinition document, ResolutionEnvironment environment) {
        var resolved = new LinkedHashMap<String, ActionDefinition>();
        document.actions().forEach((id, action) -> {
            try {
                resolved.put(id, actionResolver.resolve(action));
            } catch (ActionResolutionException ex) {
                log.warn("Dropping action '{}': {}", id, ex.getMessage());
                environment.reportError(new ResolutionError("actions." + id, ex.code(), ex.getMessage()));
            }
        });
        return resolved;
    }

    private RootNode resolveRoot(RootComponent root, ResolutionEnvironment environment, ViewNode viewRoot) {
        ResolvedStyle style;
        try {
            style = environment.styles().resolve(root.styleId());
        } catch (StyleCycleException ex) {
            log.warn("Ignoring root style: {}", ex.getMessage());
            environment.reportError(new ResolutionError("root", ex.code(), ex.getMessage()));
            style = ResolvedStyle.empty();
        }
        var scope = ResolutionScope.root();
        var children = new ArrayList<RenderNode>(root.children().size());
        for (int i = 0; i < root.children().size(); i++) {
            var childScope = scope.child(String.valueOf(i), ".children[" + i + "]");
            var child = resolveNode(root.children().get(i), childScope, viewRoot, environment);
            if (child != null) {
                children.add(child);
            }
        }
        var context = new ResolutionContext(environment, scope, null);
        var backgroundColor = root.backgroundColor() != null
            ? Color.parse(root.backgroundColor())
            : style.backgroundColor();
        return new RootNode(
            backgroundColor,
            root.edgeInsets() == null || root.edgeInsets().isEmpty() ? null : root.edgeInsets(),
            ColorScheme.from(root.colorScheme()),
            context.action(root.onAppear()),
            context.action(root.onDisappear()),
            style.padding(),
            style.cornerRadius() == null ? 0 : style.cornerRadius(),
            style.shadow(),
            style.border(),
            children
        );
    }

    record Resolved(RenderNode node, ViewNode view) {}
}
