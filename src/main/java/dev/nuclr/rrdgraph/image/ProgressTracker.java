package dev.nuclr.rrdgraph.image;

import java.util.function.DoubleConsumer;

/**
 * Derives one progress fraction from the current burst of renders, or from the
 * running report when there is one. Reports {@link #IDLE} when nothing is outstanding.
 *
 * <p>Not thread-safe apart from {@link #progress()}: mutators run on the event loop.
 */
public final class ProgressTracker {

    public static final double IDLE = -1;

    private final DoubleConsumer onChange;

    private int burstRequested;
    private int burstCompleted;

    private boolean reportActive;
    private int reportTotal;
    private int reportCompleted;

    private volatile double progress = IDLE;

    public ProgressTracker(DoubleConsumer onChange) {
        this.onChange = onChange;
    }

    public double progress() {
        return progress;
    }

    public void requestIssued() {
        burstRequested++;
        recompute();
    }

    public void requestResolved() {
        burstCompleted++;
        if (burstCompleted >= burstRequested) {
            burstRequested = 0;
            burstCompleted = 0;
        }
        recompute();
    }

    public void reportStarted(int total) {
        reportActive = true;
        reportTotal = total;
        reportCompleted = 0;
        recompute();
    }

    public void reportProgress(int completed) {
        reportCompleted = completed;
        recompute();
    }

    public void reportFinished() {
        reportActive = false;
        reportTotal = 0;
        reportCompleted = 0;
        recompute();
    }

    private void recompute() {
        double value;
        if (reportActive && reportTotal > 0) {
            value = (double) reportCompleted / reportTotal;
        } else if (burstRequested > 0) {
            value = (double) burstCompleted / burstRequested;
        } else {
            value = IDLE;
        }
        if (Double.compare(value, progress) != 0) {
            progress = value;
            onChange.accept(value);
        }
    }
}
