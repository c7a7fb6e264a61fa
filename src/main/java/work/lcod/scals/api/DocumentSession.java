package work.lcod.scals.api;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scals.action.ActionContext;
import work.lcod.scals.document.DocumentDefinition;
import work.lcod.scals.ir.ActionRef;
import work.lcod.scals.ir.RenderTree;
import work.lcod.scals.ir.RenderUpdate;
import work.lcod.scals.ir.Renderer;
import work.lcod.scals.resolution.RenderListener;
import work.lcod.scals.resolution.ResolutionResult;
import work.lcod.scals.resolution.ViewTreeUpdater;
import work.lcod.scals.shared.SerialExecutor;
import work.lcod.scals.state.StateStore;
import work.lcod.scals.state.StateSubscription;

/**
 * One document bound to one state store. Renderers read the current tree, write state through
 * {@link #store()} and run actions through {@link #execute}.
 *
 * <p>With tracking enabled, state changes re-resolve only the affected subtrees and listeners get
 * the splices. Without it, every change re-resolves the whole document and listeners get an
 * empty update.
 */
public final class DocumentSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DocumentSession.class);

    private final String id = UUID.randomUUID().toString();
    private final ScalsEngine engine;
    private final DocumentDefinition document;
    private final StateStore store;
    private final SerialExecutor executor;
    private final ActionContext actions;
    private final ViewTreeUpdater updater;
    private final StateSubscription fullRefresh;
    private final List<RenderListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean refreshScheduled = new AtomicBoolean();
    private volatile RenderTree untrackedTree;

    DocumentSession(ScalsEngine engine, DocumentDefinition document, StateStore store) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.document = Objects.requireNonNull(document, "document");
        this.store = Objects.requireNonNull(store, "store");
        this.executor = new SerialExecutor(engine.configuration().resolutionExecutor());
        if (store.values().fields().isEmpty()) {
            store.initialize(document.state());
        }
        this.actions = new ActionContext(
            id,
            store,
            document.actions(),
            engine.actionResolver(),
            engine.actionRegistry(),
            engine.delegate(),
            engine.presenter()
        );
        ResolutionResult result = engine.resolver().resolve(document, store);
        if (!result.errors().isEmpty()) {
            log.warn("Document '{}' resolved with {} error(s)", document.id(), result.errors().size());
        }
        if (result.isTracked()) {
            this.updater = new ViewTreeUpdater(result, executor);
            this.updater.addListener(this::notifyListeners);
            this.fullRefresh = null;
        } else {
            this.updater = null;
            this.untrackedTree = result.tree();
            this.fullRefresh = store.observeAll((path, oldValue, newValue) -> scheduleRefresh());
        }
        log.debug("Opened session {} for document '{}'", id, document.id());
    }

    public String id() {
        return id;
    }

    public DocumentDefinition document() {
        return document;
    }

    /** Read/write handle on the session's state. */
    public StateStore store() {
        return store;
    }

    public RenderTree tree() {
        return updater != null ? updater.tree() : untrackedTree;
    }

    public boolean isTracked() {
        return updater != null;
    }

    public <O> O render(Renderer<O> renderer) {
        return renderer.render(tree());
    }

    public void addRenderListener(RenderListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeRenderListener(RenderListener listener) {
        listeners.remove(listener);
    }

    /** Runs a document action by id. Failures are logged; the future still completes normally. */
    public CompletableFuture<Void> execute(String actionId) {
        return actions.execute(actionId);
    }

    public CompletableFuture<Void> execute(String actionId, String requestId) {
        return actions.execute(actionId, requestId);
    }

    /** Runs the action attached to a render node. */
    public CompletableFuture<Void> execute(ActionRef ref) {
        if (ref == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (ref.actionId() != null) {
            return actions.execute(ref.actionId());
        }
        var requestId = UUID.randomUUID().toString();
        var token = engine.actionRegistry().track(id, requestId);
        return actions.execute(ref.inline(), token)
            .whenComplete((ignored, error) -> engine.actionRegistry().release(id, requestId));
    }

    public boolean cancel(String requestId) {
        return engine.actionRegistry().cancel(id, requestId);
    }

    public int cancelAll() {
        return engine.actionRegistry().cancelAll(id);
    }

    private void scheduleRefresh() {
        if (refreshScheduled.compareAndSet(false, true)) {
            executor.execute(this::refresh);
        }
    }

    private void refresh() {
        refreshScheduled.set(false);
        store.clearDirtyPaths();
        untrackedTree = engine.resolver().resolve(document, store).tree();
        notifyListeners(untrackedTree, new RenderUpdate(List.of()));
    }

    private void notifyListeners(RenderTree tree, RenderUpdate update) {
        for (var listener : listeners) {
            listener.onUpdate(tree, update);
        }
    }

    @Override
    public void close() {
        cancelAll();
        if (updater != null) {
            updater.close();
        }
        if (fullRefresh != null) {
            fullRefresh.close();
        }
        listeners.clear();
        log.debug("Closed session {}", id);
    }
}
