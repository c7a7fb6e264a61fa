package work.lcod.scals.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SerialExecutorTest {

    @Test
    void runsInSubmissionOrder() {
        var order = new ArrayList<Integer>();
        var executor = new SerialExecutor();
        for (int i = 0; i < 5; i++) {
            int value = i;
            executor.execute(() -> order.add(value));
        }
        assertEquals(List.of(0, 1, 2, 3, 4), order);
    }

    @Test
    void nestedSubmissionRunsAfterCurrentTask() {
        var order = new ArrayList<String>();
        var executor = new SerialExecutor();
        executor.execute(() -> {
            order.add("outer-start");
            executor.execute(() -> order.add("inner"));
            order.add("outer-end");
        });
        assertEquals(List.of("outer-start", "outer-end", "inner"), order);
    }

    @Test
    void failingTaskDoesNotStopTheQueue() {
        var pending = new ArrayList<Runnable>();
        var order = new ArrayList<String>();
        var executor = new SerialExecutor(pending::add);
        executor.execute(() -> {
            throw new IllegalStateException("boom");
        });
        executor.execute(() -> order.add("after"));

        assertEquals(1, pending.size());
        pending.get(0).run();
        assertEquals(List.of("after"), order);
    }

    @Test
    void drainsOnHostThreadOneTaskAtATime() throws Exception {
        var pool = Executors.newFixedThreadPool(4);
        try {
            var executor = new SerialExecutor(pool);
            var seen = new CopyOnWriteArrayList<Integer>();
            var done = new CountDownLatch(50);
            for (int i = 0; i < 50; i++) {
                int value = i;
                executor.execute(() -> {
                    seen.add(value);
                    done.countDown();
                });
            }
            assertEquals(true, done.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 50; i++) {
                assertEquals(i, seen.get(i));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsNullTask() {
        assertThrows(NullPointerException.class, () -> new SerialExecutor().execute(null));
    }
}
