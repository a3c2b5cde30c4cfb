package dev.nuclr.rrdgraph.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutorEventSchedulerTest {

    private ExecutorEventScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ExecutorEventScheduler("event-loop-test");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private void drain() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        scheduler.execute(done::countDown);
        assertTrue(done.await(5, TimeUnit.SECONDS), "event loop did not drain");
    }

    @Test
    void tasksRunInSubmissionOrderOnOneNamedThread() throws Exception {
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 50; i++) {
            int n = i;
            scheduler.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread().getName());
            });
        }
        drain();

        assertEquals(50, order.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(i, order.get(i));
        }
        assertTrue(threads.stream().allMatch("event-loop-test"::equals));
    }

    @Test
    void scheduledTaskRunsAfterDelay() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        long start = System.nanoTime();

        scheduler.schedule(fired::countDown, Duration.ofMillis(100));

        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    void failingTaskDoesNotStopTheLoop() throws Exception {
        AtomicReference<String> after = new AtomicReference<>();

        scheduler.execute(() -> {
            throw new IllegalStateException("boom");
        });
        scheduler.execute(() -> after.set("ran"));
        drain();

        assertEquals("ran", after.get());
    }

    @Test
    void tasksAfterShutdownAreDropped() throws Exception {
        CountDownLatch late = new CountDownLatch(1);

        scheduler.shutdown();
        scheduler.execute(late::countDown);
        scheduler.schedule(late::countDown, Duration.ZERO);

        assertFalse(late.await(200, TimeUnit.MILLISECONDS));
    }
}
