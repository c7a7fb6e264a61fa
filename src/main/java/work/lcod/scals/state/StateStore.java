package work.lcod.scals.state;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Path-addressed mutable state shared between resolution and action execution.
 *
 * <p>Every read-modify-write holds one internal lock, so the store may be written from any thread.
 * Listeners run synchronously on the writing thread once the write has completed and the lock has
 * been released. A listener must not write back into the store that notified it.
 */
public final class StateStore implements StateReader {
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<KeyPath> dirtyPaths = new LinkedHashSet<>();
    private final List<Observer> observers = new CopyOnWriteArrayList<>();
    private final ThreadLocal<Integer> notifyDepth = ThreadLocal.withInitial(() -> 0);
    private volatile JsonValue.ObjectValue root = JsonValue.ObjectValue.EMPTY;

    public StateStore() {}

    public StateStore(Map<String, JsonValue> initial) {
        initialize(initial);
    }

    /**
     * Replaces the whole content without notifying listeners or marking anything dirty.
     */
    public void initialize(Map<String, JsonValue> initial) {
        assertNotNotifying("initialize");
        lock.lock();
        try {
            root = JsonValue.object(initial == null ? Map.of() : initial);
            dirtyPaths.clear();
        } finally {
            lock.unlock();
        }
    }

    public JsonValue get(String path) {
        return KeyPath.parse(path).get(root);
    }

    @Override
    public JsonValue read(String path) {
        return get(path);
    }

    public JsonValue.ObjectValue values() {
        return root;
    }

    public void set(String path, JsonValue value) {
        mutate(path, old -> value == null ? JsonValue.NULL : value);
    }

    public void set(String path, Object value) {
        set(path, JsonValue.from(value));
    }

    public void append(String path, JsonValue value) {
        mutateArray(path, items -> {
            items.add(value);
            return items;
        });
    }

    /** Removes every element equal to {@code value}. */
    public void removeByValue(String path, JsonValue value) {
        mutateArray(path, items -> {
            items.removeIf(item -> JsonValues.looselyEquals(item, value));
            return items;
        });
    }

    public void removeAt(String path, int index) {
        mutateArray(path, items -> {
            if (index >= 0 && index < items.size()) {
                items.remove(index);
            }
            return items;
        });
    }

    /** Removes {@code value} when present, appends it otherwise. */
    public void toggleMembership(String path, JsonValue value) {
        mutateArray(path, items -> {
            if (items.stream().anyMatch(item -> JsonValues.looselyEquals(item, value))) {
                items.removeIf(item -> JsonValues.looselyEquals(item, value));
            } else {
                items.add(value);
            }
            return items;
        });
    }

    public void setArrayItem(String path, int index, JsonValue value) {
        mutateArray(path, items -> {
            if (index >= 0 && index < items.size()) {
                items.set(index, value);
            }
            return items;
        });
    }

    public void clearArray(String path) {
        mutateArray(path, items -> new ArrayList<>());
    }

    public StateSubscription observe(String path, StateChangeListener listener) {
        var observer = new Observer(KeyPath.parse(path), Objects.requireNonNull(listener, "listener"));
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    public StateSubscription observeAll(StateChangeListener listener) {
        return observe("", listener);
    }

    /**
     * Returns the paths written since the previous call and forgets them.
     */
    public Set<String> consumeDirtyPaths() {
        lock.lock();
        try {
            var result = new LinkedHashSet<String>();
            dirtyPaths.forEach(path -> result.add(path.toString()));
            dirtyPaths.clear();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** True when {@code path} or one of its children was written since the last consumption. */
    public boolean isDirty(String path) {
        var key = KeyPath.parse(path);
        lock.lock();
        try {
            return dirtyPaths.stream().anyMatch(dirty -> dirty.startsWith(key));
        } finally {
            lock.unlock();
        }
    }

    public void clearDirtyPaths() {
        lock.lock();
        try {
            dirtyPaths.clear();
        } finally {
            lock.unlock();
        }
    }

    public StateSnapshot snapshot() {
        return new StateSnapshot(root);
    }

    /**
     * Replaces the content with {@code snapshot}; every top-level key that differs is marked dirty
     * and reported to listeners.
     */
    public void restore(StateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        assertNotNotifying("restore");
        var changes = new ArrayList<Change>();
        lock.lock();
        try {
            var previous = root;
            var keys = new LinkedHashSet<String>(previous.fields().keySet());
            keys.addAll(snapshot.values().fields().keySet());
            for (var key : keys) {
                var oldValue = previous.get(key);
                var newValue = snapshot.values().get(key);
                if (!oldValue.equals(newValue)) {
                    changes.add(new Change(new KeyPath(List.of(key)), oldValue, newValue));
                    markDirty(new KeyPath(List.of(key)));
                }
            }
            root = snapshot.values();
        } finally {
            lock.unlock();
        }
        changes.forEach(this::notifyObservers);
    }

    private void mutateArray(String path, UnaryOperator<List<JsonValue>> edit) {
        mutate(path, old -> {
            if (!old.isNull() && !(old instanceof JsonValue.ArrayValue)) {
                log.debug("Ignoring array mutation on non-array path '{}'", path);
                return old;
            }
            var items = new ArrayList<>(old.asArray().orElse(List.of()));
            return JsonValue.array(edit.apply(items));
        });
    }

    private void mutate(String path, UnaryOperator<JsonValue> update) {
        assertNotNotifying(path);
        var key = KeyPath.parse(path);
        if (key.isRoot()) {
            throw new IllegalArgumentException("State path must not be empty");
        }
        Change change;
        lock.lock();
        try {
            var oldValue = key.get(root);
            var newValue = update.apply(oldValue);
            if (oldValue.equals(newValue)) {
                return;
            }
            var updated = key.set(root, newValue);
            if (updated == root) {
                log.debug("Ignoring write to '{}': index past the end of its array", path);
                return;
            }
            root = (JsonValue.ObjectValue) updated;
            markDirty(key);
            change = new Change(key, oldValue, newValue);
        } finally {
            lock.unlock();
        }
        notifyObservers(change);
    }

    private void markDirty(KeyPath key) {
        dirtyPaths.add(key);
        dirtyPaths.addAll(key.ancestors());
    }

    private void notifyObservers(Change change) {
        notifyDepth.set(notifyDepth.get() + 1);
        try {
            for (var observer : observers) {
                if (observer.path().overlaps(change.path())) {
                    observer.listener().onChange(change.path().toString(), change.oldValue(), change.newValue());
                }
            }
        } finally {
            notifyDepth.set(notifyDepth.get() - 1);
        }
    }

    private void assertNotNotifying(String path) {
        if (notifyDepth.get() > 0) {
            throw new IllegalStateException("State write to '" + path + "' from inside a change listener");
        }
    }

    private record Observer(KeyPath path, StateChangeListener listener) {}

    private record Change(KeyPath path, JsonValue oldValue, JsonValue newValue) {}
}
