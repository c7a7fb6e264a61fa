package work.lcod.scals.resolution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import work.lcod.scals.document.LayoutNode;
import work.lcod.scals.state.KeyPath;

/**
 * Tracked counterpart of one render node. Owns its children in render order and keeps a plain
 * back-reference to its parent, cleared when the node is detached.
 *
 * <p>Only touched from the resolution thread.
 */
public final class ViewNode {
    private final String id;
    private final LayoutNode source;
    private final ResolutionScope scope;
    private final Set<String> readPaths = new LinkedHashSet<>();
    private final Set<String> writePaths = new LinkedHashSet<>();
    private final List<ViewNode> children = new ArrayList<>();
    private ViewNode parent;

    ViewNode(String id, LayoutNode source, ResolutionScope scope) {
        this.id = id;
        this.source = source;
        this.scope = scope;
    }

    static ViewNode root() {
        return new ViewNode("root", null, ResolutionScope.root());
    }

    public String id() {
        return id;
    }

    /** Document node this view was resolved from; {@code null} for the root. */
    public LayoutNode source() {
        return source;
    }

    ResolutionScope scope() {
        return scope;
    }

    public ViewNode parent() {
        return parent;
    }

    public List<ViewNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Set<String> readPaths() {
        return Collections.unmodifiableSet(readPaths);
    }

    public Set<String> writePaths() {
        return Collections.unmodifiableSet(writePaths);
    }

    public boolean isRoot() {
        return source == null;
    }

    void recordRead(String path) {
        readPaths.add(KeyPath.canonical(path));
    }

    void recordWrite(String path) {
        var canonical = KeyPath.canonical(path);
        writePaths.add(canonical);
        readPaths.add(canonical);
    }

    void attach(ViewNode child) {
        child.parent = this;
        children.add(child);
    }

    /**
     * Swaps {@code current} for {@code replacement} at the same position. The old subtree is
     * detached.
     */
    void replaceChild(ViewNode current, ViewNode replacement) {
        var index = indexOf(current);
        if (index < 0) {
            throw new IllegalArgumentException("View node '" + current.id + "' is not a child of '" + id + "'");
        }
        children.set(index, replacement);
        replacement.parent = this;
        current.parent = null;
    }

    /** True when {@code other} is a strict ancestor of this node. */
    public boolean hasAncestor(ViewNode other) {
        for (var current = parent; current != null; current = current.parent) {
            if (current == other) {
                return true;
            }
        }
        return false;
    }

    /** This node followed by all its descendants, depth first. */
    public List<ViewNode> subtree() {
        var result = new ArrayList<ViewNode>();
        var pending = new ArrayDeque<ViewNode>();
        pending.push(this);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
            }
        }
        return result;
    }

    /**
     * Child indexes from the root view down to this node, matching positions in the render tree.
     * Empty for the root; {@code null} when the node is no longer attached to a root.
     */
    public List<Integer> childPath() {
        var path = new ArrayDeque<Integer>();
        var current = this;
        while (current.parent != null) {
            path.addFirst(current.parent.indexOf(current));
            current = current.parent;
        }
        return current.isRoot() ? new ArrayList<>(path) : null;
    }

    private int indexOf(ViewNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "ViewNode[" + id + "]";
    }
}
