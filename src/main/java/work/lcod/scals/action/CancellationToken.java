package work.lcod.scals.action;

/**
 * Cooperative cancellation flag threaded through an action invocation and all of its steps.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
