package work.lcod.scals.resolution;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import work.lcod.scals.state.KeyPath;

/**
 * Maps canonical state paths to the view nodes that read them.
 */
public final class DependencyIndex {
    private final Map<KeyPath, Set<ViewNode>> byPath = new LinkedHashMap<>();

    /** Indexes {@code node} and every descendant. */
    public void index(ViewNode node) {
        for (var member : node.subtree()) {
            for (var path : member.readPaths()) {
                byPath.computeIfAbsent(KeyPath.parse(path), key -> new LinkedHashSet<>()).add(member);
            }
        }
    }

    /** Drops {@code node} and every descendant. */
    public void remove(ViewNode node) {
        var members = node.subtree();
        var iterator = byPath.values().iterator();
        while (iterator.hasNext()) {
            var nodes = iterator.next();
            members.forEach(nodes::remove);
            if (nodes.isEmpty()) {
                iterator.remove();
            }
        }
    }

    /**
     * Nodes reading {@code path}, one of its ancestors or one of its descendants.
     */
    public Set<ViewNode> nodesAffectedBy(String path) {
        var key = KeyPath.parse(path);
        var result = new LinkedHashSet<ViewNode>();
        byPath.forEach((indexed, nodes) -> {
            if (indexed.overlaps(key)) {
                result.addAll(nodes);
            }
        });
        return result;
    }

    public Set<ViewNode> nodesAffectedBy(Iterable<String> paths) {
        var result = new LinkedHashSet<ViewNode>();
        paths.forEach(path -> result.addAll(nodesAffectedBy(path)));
        return result;
    }

    public boolean isEmpty() {
        return byPath.isEmpty();
    }

    public void clear() {
        byPath.clear();
    }
}
