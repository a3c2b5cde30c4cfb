package dev.nuclr.rrdgraph.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import dev.nuclr.rrdgraph.image.ImageDispatcher;
import dev.nuclr.rrdgraph.image.ImageRequest;
import dev.nuclr.rrdgraph.image.ImageTypeRegistry;
import dev.nuclr.rrdgraph.image.ImageWaiter;
import dev.nuclr.rrdgraph.image.ProgressTracker;
import dev.nuclr.rrdgraph.service.CommandQueue;
import dev.nuclr.rrdgraph.service.EventScheduler;
import dev.nuclr.rrdgraph.service.PixelSize;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders one full-size image per registered type into a fresh directory.
 *
 * <p>States: idle ({@code run == null}) and running. Each step, fired by the
 * scheduler, submits the next type only when the command queue is idle, so a
 * report never has more than one render outstanding and ad-hoc requests are
 * not starved. A new report replaces a running one; results of the replaced run
 * are ignored when they arrive.
 *
 * <p>Not thread-safe apart from {@link #reporting()}: every other method runs on the event loop.
 */
@Slf4j
public final class ReportGenerator {

    /** Receives report events on the event loop. */
    public interface Listener {

        void reportingChanged(boolean reporting);

        void reportComplete(Path directory);

        void reportError(String error);
    }

    private static final DateTimeFormatter DIR_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final Path reportRoot;
    private final Duration step;
    private final ImageTypeRegistry registry;
    private final ImageDispatcher dispatcher;
    private final CommandQueue queue;
    private final ProgressTracker progress;
    private final EventScheduler scheduler;
    private final Clock clock;
    private final Listener listener;

    private volatile ReportRun run;
    private long nextRunId;

    public ReportGenerator(Path reportRoot, Duration step, ImageTypeRegistry registry,
                           ImageDispatcher dispatcher, CommandQueue queue, ProgressTracker progress,
                           EventScheduler scheduler, Clock clock, Listener listener) {
        this.reportRoot = reportRoot;
        this.step = step;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.queue = queue;
        this.progress = progress;
        this.scheduler = scheduler;
        this.clock = clock;
        this.listener = listener;
    }

    public boolean reporting() {
        return run != null;
    }

    /** Current run, or {@code null} when idle. */
    public ReportRun currentRun() {
        return run;
    }

    /**
     * Starts a report over {@code [from, from + duration)}. A running report is abandoned.
     */
    public void makeReport(long from, long duration, PixelSize size) {
        Path dir;
        try {
            dir = createOutputDirectory();
        } catch (IOException e) {
            log.error("Cannot create report directory under {}: {}", reportRoot, e.getMessage());
            listener.reportError("Cannot create report directory: " + e.getMessage());
            return;
        }

        boolean wasRunning = run != null;
        if (wasRunning) {
            log.info("Abandoning report into {}", run.getOutputDirectory());
        }

        List<String> types = registry.names();
        ReportRun started = new ReportRun(++nextRunId, from, duration, size, dir, types);
        run = started;
        log.info("Report started: {} image(s) into {}", types.size(), dir);

        if (types.isEmpty()) {
            finish(started, wasRunning);
            return;
        }

        progress.reportStarted(started.getTotalCount());
        if (!wasRunning) {
            listener.reportingChanged(true);
        }
        long id = started.getId();
        scheduler.execute(() -> step(id));
    }

    private void step(long runId) {
        ReportRun current = run;
        if (current == null || current.getId() != runId || !current.hasRemaining()) {
            return;
        }
        if (queue.isIdle()) {
            issue(current, current.nextType());
        }
        // the issued request may have completed synchronously and finished the run
        if (run == current && current.hasRemaining()) {
            scheduler.schedule(() -> step(runId), step);
        }
    }

    private void issue(ReportRun current, String type) {
        ImageRequest request = new ImageRequest(
                type, current.getFrom(), current.getDuration(), current.getSize(), true);
        dispatcher.request(request, new ImageWaiter() {
            @Override
            public void imageReady(Path file) {
                collected(current, type, file);
            }

            @Override
            public void imageFailed(String error) {
                log.warn("Report image '{}' failed: {}", type, error);
                collected(current, type, null);
            }
        });
    }

    private void collected(ReportRun owner, String type, Path file) {
        if (run != owner) {
            log.debug("Ignoring result of abandoned report run for '{}'", type);
            return;
        }
        if (file != null) {
            Path target = owner.getOutputDirectory().resolve(fileNameFor(type));
            try {
                Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.error("Cannot save report image {}: {}", target, e.getMessage());
                listener.reportError("Cannot save report image " + target + ": " + e.getMessage());
            }
        }

        progress.reportProgress(owner.markCompleted());
        if (owner.isDone()) {
            finish(owner, true);
        }
    }

    private void finish(ReportRun finished, boolean announced) {
        run = null;
        progress.reportFinished();
        log.info("Report complete: {}", finished.getOutputDirectory());
        if (announced) {
            listener.reportingChanged(false);
        }
        listener.reportComplete(finished.getOutputDirectory());
    }

    private Path createOutputDirectory() throws IOException {
        String stamp = LocalDateTime.now(clock).format(DIR_FORMAT);
        Path dir = reportRoot.resolve(stamp);
        for (int i = 2; Files.exists(dir); i++) {
            dir = reportRoot.resolve(stamp + "-" + i);
        }
        return Files.createDirectories(dir);
    }

    static String fileNameFor(String type) {
        return type.replaceAll("[^A-Za-z0-9._-]", "_") + ".png";
    }
}
