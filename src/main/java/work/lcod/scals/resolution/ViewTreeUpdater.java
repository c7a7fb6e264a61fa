package work.lcod.scals.resolution;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.RenderUpdate;
import work.lcod.scals.ir.ResolutionError;
import work.lcod.scals.state.KeyPath;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.state.StateSubscription;

/**
 * Keeps a tracked {@link ResolutionResult} in sync with its store.
 *
 * <p>Store writes schedule a pass on the given executor. A pass consumes the dirty paths, finds
 * the view nodes that read them, and re-resolves only the topmost of those with the scope they
 * were first resolved in. Every other node, and every render subtree outside the re-resolved
 * ones, is left as it was.
 */
public final class ViewTreeUpdater implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ViewTreeUpdater.class);

    private final ResolutionEnvironment environment;
    private final ViewNode viewRoot;
    private final StateStore store;
    private final Executor executor;
    private final DependencyIndex index = new DependencyIndex();
    private final ConcurrentLinkedQueue<String> written = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private final List<RenderListener> listeners = new CopyOnWriteArrayList<>();
    private final StateSubscription subscription;
    private volatile RenderTree tree;
    private volatile boolean closed;

    /**
     * @param executor where passes run; must be serial, see {@link work.lcod.scals.shared.SerialExecutor}
     * @throws IllegalArgumentException when {@code result} was resolved without tracking
     */
    public ViewTreeUpdater(ResolutionResult result, Executor executor) {
        Objects.requireNonNull(result, "result");
        this.viewRoot = result.viewRoot()
            .orElseThrow(() -> new IllegalArgumentException("Incremental updates need a tracked resolution result"));
        this.environment = result.environment();
        this.store = environment.store();
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tree = result.tree();
        index.index(viewRoot);
        store.clearDirtyPaths();
        this.subscription = store.observeAll((path, oldValue, newValue) -> onStateChange(path));
    }

    public RenderTree tree() {
        return tree;
    }

    public ViewNode viewRoot() {
        return viewRoot;
    }

    public DependencyIndex dependencyIndex() {
        return index;
    }

    public void addListener(RenderListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RenderListener listener) {
        listeners.remove(listener);
    }

    private void onStateChange(String path) {
        if (closed) {
            return;
        }
        written.add(path);
        if (scheduled.compareAndSet(false, true)) {
            executor.execute(this::flush);
        }
    }

    /**
     * Runs one pass now. Normally invoked through the executor; returns the applied update, which
     * is empty when nothing depended on the changed paths.
     */
    public RenderUpdate flush() {
        scheduled.set(false);
        if (closed) {
            return new RenderUpdate(List.of());
        }
        var changed = affectedPaths();
        if (changed.isEmpty()) {
            return new RenderUpdate(List.of());
        }
        var affected = index.nodesAffectedBy(changed);
        var topmost = new ArrayList<ViewNode>();
        for (var node : affected) {
            if (affected.stream().noneMatch(node::hasAncestor)) {
                topmost.add(node);
            }
        }
        log.debug("State change on {} affects {} view nodes, re-resolving {}", changed, affected.size(), topmost.size());

        var splices = new ArrayList<RenderUpdate.Splice>();
        var current = tree;
        for (var view : topmost) {
            var path = view.childPath();
            if (path == null || path.isEmpty()) {
                continue;
            }
            var resolved = environment.resolver().resolveTracked(view.source(), view.scope(), environment);
            if (resolved == null) {
                log.warn("Re-resolution of '{}' failed, keeping the previous subtree", view.id());
                continue;
            }
            view.parent().replaceChild(view, resolved.view());
            index.remove(view);
            index.index(resolved.view());
            current = current.replace(path, resolved.node());
            splices.add(new RenderUpdate.Splice(path, resolved.node()));
        }
        current = mergeErrors(current, environment.drainErrors());
        tree = current;

        var update = new RenderUpdate(splices);
        if (!update.isEmpty()) {
            for (var listener : listeners) {
                listener.onUpdate(current, update);
            }
        }
        return update;
    }

    /**
     * Dirty paths include every ancestor of a written path. An ancestor is kept only when it was
     * written itself, so that writing {@code user.name} does not invalidate readers of
     * {@code user.email}.
     */
    private Set<String> affectedPaths() {
        var dirty = new ArrayList<KeyPath>();
        store.consumeDirtyPaths().forEach(path -> dirty.add(KeyPath.parse(path)));
        var result = new LinkedHashSet<String>();
        for (var path : dirty) {
            var isStrictAncestor = dirty.stream().anyMatch(other -> !other.equals(path) && other.startsWith(path));
            if (!isStrictAncestor) {
                result.add(path.toString());
            }
        }
        String path;
        while ((path = written.poll()) != null) {
            result.add(KeyPath.canonical(path));
        }
        return result;
    }

    private static RenderTree mergeErrors(RenderTree tree, List<ResolutionError> fresh) {
        if (fresh.isEmpty()) {
            return tree;
        }
        var errors = new LinkedHashSet<>(tree.errors());
        errors.addAll(fresh);
        return tree.withErrors(new ArrayList<>(errors));
    }

    @Override
    public void close() {
        closed = true;
        subscription.close();
        listeners.clear();
        index.clear();
    }
}
