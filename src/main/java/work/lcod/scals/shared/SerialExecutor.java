package work.lcod.scals.shared;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs submitted tasks one at a time, in submission order, on a host executor. Tasks submitted
 * while another one runs are queued behind it, including tasks submitted from the running task.
 */
public final class SerialExecutor implements Executor {
    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private final Executor host;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;

    /** Runs tasks on the submitting thread. */
    public SerialExecutor() {
        this(Runnable::run);
    }

    public SerialExecutor(Executor host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (tasks) {
            tasks.add(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        host.execute(this::drain);
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (tasks) {
                next = tasks.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException ex) {
                log.error("Serial task failed", ex);
            }
        }
    }
}
