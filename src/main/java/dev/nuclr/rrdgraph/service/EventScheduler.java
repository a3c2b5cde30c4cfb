package dev.nuclr.rrdgraph.service;

import java.time.Duration;

/**
 * Single logical thread of control. Every state change of the generator runs as a
 * task on this scheduler, so tasks never overlap and run in submission order.
 */
public interface EventScheduler {

    void execute(Runnable task);

    /** Runs {@code task} once after {@code delay}. There is no cancellation; stale tasks check their own state. */
    void schedule(Runnable task, Duration delay);

    void shutdown();
}
