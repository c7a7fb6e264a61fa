package work.lcod.scals.resolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.action.ActionResolutionException;
import work.lcod.scals.document.ActionBinding;
import work.lcod.scals.document.DataReference;
import work.lcod.scals.document.LayoutNode;
import work.lcod.scals.document.Style;
import work.lcod.scals.ir.ActionRef;
import work.lcod.scals.ir.RenderNode;
import work.lcod.scals.state.ExpressionEvaluator;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.KeyPath;
import work.lcod.scals.state.StateReader;
import work.lcod.scals.style.ResolvedStyle;

/**
 * What a resolver sees while resolving one node: state reads (loop variables first, then the
 * store), styles, actions and the means to resolve children.
 *
 * <p>Store reads made through this context are recorded against the node being resolved, so the
 * node is re-resolved when one of those paths changes. Loop variable reads are not recorded; the
 * repeater that bound them already depends on its array.
 */
public final class ResolutionContext implements StateReader {
    private static final Logger log = LoggerFactory.getLogger(ResolutionContext.class);

    private final ResolutionEnvironment environment;
    private final ResolutionScope scope;
    private final ViewNode viewNode;

    ResolutionContext(ResolutionEnvironment environment, ResolutionScope scope, ViewNode viewNode) {
        this.environment = environment;
        this.scope = scope;
        this.viewNode = viewNode;
    }

    @Override
    public JsonValue read(String path) {
        var key = KeyPath.parse(path);
        var bound = scope.variables().get(key.head());
        if (bound != null) {
            return key.tail().get(bound);
        }
        if (environment.isTracking()) {
            environment.tracker().recordRead(path);
        }
        return environment.store().get(path);
    }

    /** Reads from the local state declared by enclosing layouts. Never tracked. */
    public JsonValue readLocal(String path) {
        return KeyPath.parse(path).get(scope.localState());
    }

    /** Marks a two-way binding target; a write also counts as a read. */
    public void recordWrite(String path) {
        if (environment.isTracking() && path != null) {
            environment.tracker().recordWrite(path);
        }
    }

    public String interpolate(String template) {
        return ExpressionEvaluator.interpolate(template, this);
    }

    public JsonValue evaluate(String expression) {
        return ExpressionEvaluator.evaluate(expression, this);
    }

    /**
     * @throws work.lcod.scals.style.StyleCycleException when the chain loops; the node is dropped
     */
    public ResolvedStyle style(String styleId, Style inline) {
        return environment.styles().resolve(styleId, inline);
    }

    public ResolvedStyle style(String styleId) {
        return environment.styles().resolve(styleId);
    }

    /** The document id when there is one, otherwise the structural id of this position. */
    public String nodeId(String documentId) {
        return documentId != null && !documentId.isBlank() ? documentId : scope.structuralId();
    }

    public String structuralId() {
        return scope.structuralId();
    }

    public String documentPath() {
        return scope.documentPath();
    }

    public boolean isTracking() {
        return viewNode != null;
    }

    public ResolverRegistries registries() {
        return environment.registries();
    }

    public double defaultSectionItemSpacing() {
        return environment.resolver().defaultSectionItemSpacing();
    }

    public DataReference dataSource(String id) {
        return id == null ? null : environment.document().dataSources().get(id);
    }

    /**
     * A reference is kept by id; an inline action is resolved now. An invalid inline action is
     * logged and leaves the node without that action.
     */
    public ActionRef action(ActionBinding binding) {
        if (binding == null) {
            return null;
        }
        if (binding.isReference()) {
            if (!environment.document().actions().containsKey(binding.reference())) {
                log.warn("{} references unknown action '{}'", scope.documentPath(), binding.reference());
            }
            return ActionRef.to(binding.reference());
        }
        try {
            return ActionRef.of(environment.actionResolver().resolve(binding.inline()));
        } catch (ActionResolutionException ex) {
            log.warn("Dropping inline action at {}: {}", scope.documentPath(), ex.getMessage());
            return null;
        }
    }

    /** Local state declared by a layout becomes visible to its descendants. */
    public ResolutionContext withLocalState(Map<String, JsonValue> declared) {
        return new ResolutionContext(environment, scope.withLocalState(declared), viewNode);
    }

    /**
     * Resolves a child node. Returns {@code null} when the child failed; the failure has already
     * been reported.
     *
     * @param idSegment appended to this node's structural id
     * @param pathSegment appended to this node's document path, e.g. {@code .children[2]}
     */
    public RenderNode resolveChild(LayoutNode node, String idSegment, String pathSegment) {
        return resolveChild(node, idSegment, pathSegment, Map.of());
    }

    /**
     * Resolves a child with extra variable bindings that shadow outer names of the same name for
     * this child only.
     */
    public RenderNode resolveChild(LayoutNode node, String idSegment, String pathSegment, Map<String, JsonValue> bindings) {
        var childScope = scope.child(idSegment, pathSegment);
        if (!bindings.isEmpty()) {
            childScope = childScope.withVariables(bindings);
        }
        return environment.resolver().resolveNode(node, childScope, viewNode, environment);
    }

    /** Resolves children by position; failed children are left out. */
    public List<RenderNode> resolveChildren(List<LayoutNode> children) {
        var resolved = new ArrayList<RenderNode>(children.size());
        for (int i = 0; i < children.size(); i++) {
            var child = resolveChild(children.get(i), String.valueOf(i), ".children[" + i + "]");
            if (child != null) {
                resolved.add(child);
            }
        }
        return resolved;
    }
}
