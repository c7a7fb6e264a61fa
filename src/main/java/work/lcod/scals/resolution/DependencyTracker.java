package work.lcod.scals.resolution;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Attributes state reads and writes to the view node currently being resolved. Brackets nest;
 * only the innermost one records.
 */
public final class DependencyTracker {
    private final Deque<ViewNode> stack = new ArrayDeque<>();

    public void begin(ViewNode node) {
        stack.push(node);
    }

    public void end() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("end() without matching begin()");
        }
        stack.pop();
    }

    public boolean isTracking() {
        return !stack.isEmpty();
    }

    public ViewNode current() {
        return stack.peek();
    }

    public void recordRead(String path) {
        var node = stack.peek();
        if (node != null) {
            node.recordRead(path);
        }
    }

    /** A write also counts as a read of the same path. */
    public void recordWrite(String path) {
        var node = stack.peek();
        if (node != null) {
            node.recordWrite(path);
        }
    }
}
