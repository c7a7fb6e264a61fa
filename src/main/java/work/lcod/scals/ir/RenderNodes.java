package work.lcod.scals.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural edits on immutable render nodes.
 */
public final class RenderNodes {
    private RenderNodes() {}

    public static RenderNode replace(RenderNode node, List<Integer> childPath, RenderNode replacement) {
        if (childPath.isEmpty()) {
            return replacement;
        }
        var index = childPath.get(0);
        var rest = childPath.subList(1, childPath.size());
        var children = node.children();
        if (index < 0 || index >= children.size()) {
            throw new IndexOutOfBoundsException("No child " + index + " under " + node.kind() + " '" + node.id() + "'");
        }
        var updatedChild = replace(children.get(index), rest, replacement);
        if (node instanceof ContainerNode container) {
            var copy = new ArrayList<>(container.children());
            copy.set(index, updatedChild);
            return container.withChildren(copy);
        }
        if (node instanceof SectionLayoutNode sections) {
            return sections.withChild(index, updatedChild);
        }
        throw new IllegalArgumentException("Node kind '" + node.kind() + "' has no replaceable children");
    }

    /** Number of nodes in the subtree, {@code node} included. */
    public static int count(RenderNode node) {
        var total = 1;
        for (var child : node.children()) {
            total += count(child);
        }
        return total;
    }
}
