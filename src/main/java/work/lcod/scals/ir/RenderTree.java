package work.lcod.scals.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.scals.action.ActionDefinition;

/**
 * Fully resolved output of one resolution pass. Immutable; incremental updates produce a new tree
 * that shares every untouched subtree with the previous one.
 */
public record RenderTree(
    String irVersion,
    RootNode root,
    Map<String, ActionDefinition> actions,
    List<ResolutionError> errors
) {
    public static final String IR_VERSION = "1.0.0";

    public RenderTree {
        actions = Map.copyOf(actions);
        errors = List.copyOf(errors);
    }

    /**
     * Node addressed by child indexes from the root, or {@code null} when the path leads nowhere.
     */
    public RenderNode nodeAt(List<Integer> childPath) {
        if (childPath.isEmpty()) {
            return null;
        }
        List<RenderNode> level = root.children();
        RenderNode node = null;
        for (var index : childPath) {
            if (index < 0 || index >= level.size()) {
                return null;
            }
            node = level.get(index);
            level = node.children();
        }
        return node;
    }

    /**
     * Copy with the node at {@code childPath} replaced by {@code replacement}. Ancestors along the
     * path are rebuilt; everything else is shared.
     */
    public RenderTree replace(List<Integer> childPath, RenderNode replacement) {
        if (childPath.isEmpty()) {
            throw new IllegalArgumentException("Cannot replace the root through a child path");
        }
        var children = new ArrayList<>(root.children());
        var index = childPath.get(0);
        children.set(index, RenderNodes.replace(children.get(index), childPath.subList(1, childPath.size()), replacement));
        return new RenderTree(irVersion, root.withChildren(children), actions, errors);
    }

    public RenderTree withRoot(RootNode newRoot) {
        return new RenderTree(irVersion, newRoot, actions, errors);
    }

    public RenderTree withErrors(List<ResolutionError> newErrors) {
        return new RenderTree(irVersion, root, actions, newErrors);
    }
}
