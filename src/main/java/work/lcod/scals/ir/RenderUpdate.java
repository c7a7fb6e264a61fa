package work.lcod.scals.ir;

import java.util.List;

/**
 * Subtree replacements applied to a render tree by one incremental re-resolution.
 */
public record RenderUpdate(List<Splice> splices) {
    public RenderUpdate {
        splices = List.copyOf(splices);
    }

    public boolean isEmpty() {
        return splices.isEmpty();
    }

    /**
     * @param childPath child indexes from the root to the replaced node
     */
    public record Splice(List<Integer> childPath, RenderNode node) {
        public Splice {
            childPath = List.copyOf(childPath);
        }
    }
}
