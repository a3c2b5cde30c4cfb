package dev.nuclr.rrdgraph;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import dev.nuclr.rrdgraph.service.EventScheduler;

/**
 * Deterministic {@link EventScheduler} for tests.
 *
 * <p>Tasks run on the calling thread in submission order; a task submitted while
 * another one runs is queued behind it, as on a real event loop. Timed tasks run
 * only when the test calls {@link #advance(Duration)}, which also moves the clock.
 */
public class ManualScheduler implements EventScheduler {

    private record Timed(Duration due, long seq, Runnable task) {}

    private final MutableClock clock;
    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final List<Timed> timed = new ArrayList<>();

    private Duration now = Duration.ZERO;
    private long nextSeq;
    private boolean draining;
    private boolean shutdown;

    public ManualScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void execute(Runnable task) {
        if (shutdown) {
            return;
        }
        ready.addLast(task);
        if (!draining) {
            drain();
        }
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        if (shutdown) {
            return;
        }
        timed.add(new Timed(now.plus(delay), nextSeq++, task));
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    /** Moves time forward, running every timed task that falls due on the way. */
    public void advance(Duration amount) {
        Duration target = now.plus(amount);
        while (true) {
            Timed next = timed.stream()
                    .filter(t -> t.due().compareTo(target) <= 0)
                    .min(Comparator.comparing(Timed::due).thenComparingLong(Timed::seq))
                    .orElse(null);
            if (next == null) {
                break;
            }
            timed.remove(next);
            moveTo(next.due());
            execute(next.task());
        }
        moveTo(target);
    }

    public int pendingTimers() {
        return timed.size();
    }

    private void moveTo(Duration time) {
        if (time.compareTo(now) > 0) {
            clock.advance(time.minus(now));
            now = time;
        }
    }

    private void drain() {
        draining = true;
        try {
            Runnable task;
            while ((task = ready.pollFirst()) != null) {
                task.run();
            }
        } finally {
            draining = false;
        }
    }
}
