package dev.nuclr.rrdgraph;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Stream;

import dev.nuclr.rrdgraph.cache.ImageCache;
import dev.nuclr.rrdgraph.config.GraphGeneratorConfig;
import dev.nuclr.rrdgraph.image.ImageDispatcher;
import dev.nuclr.rrdgraph.image.ImageRequest;
import dev.nuclr.rrdgraph.image.ImageType;
import dev.nuclr.rrdgraph.image.ImageTypeRegistry;
import dev.nuclr.rrdgraph.image.ImageWaiter;
import dev.nuclr.rrdgraph.image.ProgressTracker;
import dev.nuclr.rrdgraph.image.RrdGraphCommandBuilder;
import dev.nuclr.rrdgraph.report.ReportGenerator;
import dev.nuclr.rrdgraph.service.CommandQueue;
import dev.nuclr.rrdgraph.service.DefaultRendererLauncher;
import dev.nuclr.rrdgraph.service.EventScheduler;
import dev.nuclr.rrdgraph.service.ExecutorEventScheduler;
import dev.nuclr.rrdgraph.service.PixelSize;
import dev.nuclr.rrdgraph.service.ProcessSupervisor;
import dev.nuclr.rrdgraph.service.RendererLauncher;
import dev.nuclr.rrdgraph.service.RendererLocator;
import dev.nuclr.rrdgraph.service.RendererState;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates RRD plots through one {@code rrdtool} process in pipe mode.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Construct with a {@link GraphGeneratorConfig}.</li>
 *   <li>Register image types with {@link #registerImageType}.</li>
 *   <li>Call {@link #start()}; {@link GraphListener#readyChanged} reports when the renderer accepts commands.</li>
 *   <li>Ask for images with {@link #getImage} and for reports with {@link #makeReport};
 *       results arrive through {@link GraphListener}.</li>
 *   <li>Call {@link #checkCache()} periodically and {@link #close()} on shutdown.</li>
 * </ol>
 *
 * <p>Public methods may be called from any thread. They are posted to a single
 * event loop, which owns all mutable state; listeners are notified on that loop.
 * The query methods ({@link #ready()}, {@link #progress()}, {@link #reporting()},
 * {@link #isTypeRegistered}) read published state directly.
 */
@Slf4j
public final class GraphGenerator implements AutoCloseable {

    private final EventScheduler scheduler;
    private final Clock clock;
    private final Path scratchDirectory;
    private final boolean ownsScratchDirectory;

    private final List<GraphListener> listeners = new CopyOnWriteArrayList<>();

    private final ImageTypeRegistry registry = new ImageTypeRegistry();
    private final RrdGraphCommandBuilder commandBuilder = new RrdGraphCommandBuilder();
    private final ImageCache cache;
    private final ProgressTracker progress;
    private final ProcessSupervisor supervisor;
    private final CommandQueue queue;
    private final ImageDispatcher dispatcher;
    private final ReportGenerator reporter;

    private volatile boolean ready;

    public GraphGenerator(GraphGeneratorConfig config) throws IOException {
        this(config, new DefaultRendererLauncher(), new ExecutorEventScheduler("graph-generator"), Clock.systemDefaultZone());
    }

    /** Wires the generator with explicit collaborators; tests pass doubles here. */
    public GraphGenerator(GraphGeneratorConfig config, RendererLauncher launcher,
                          EventScheduler scheduler, Clock clock) throws IOException {
        this.scheduler = scheduler;
        this.clock = clock;

        if (config.getScratchDirectory() != null) {
            this.scratchDirectory = Files.createDirectories(config.getScratchDirectory());
            this.ownsScratchDirectory = false;
        } else {
            this.scratchDirectory = Files.createTempDirectory("rrdgraph-");
            this.ownsScratchDirectory = true;
        }

        this.cache = new ImageCache(seconds(config.getCacheTimeoutSeconds()));
        this.progress = new ProgressTracker(value -> fire(l -> l.progressChanged(value)));
        this.supervisor = new ProcessSupervisor(
                config, launcher, new RendererLocator(config), scheduler, new SupervisorEvents());
        this.queue = new CommandQueue(supervisor);
        this.dispatcher = new ImageDispatcher(
                registry, cache, queue, commandBuilder, progress, clock, scratchDirectory,
                error -> fire(l -> l.rendererError(error)));
        this.reporter = new ReportGenerator(
                config.getReportDirectory(), Duration.ofMillis(Math.max(0, config.getReportStepMillis())),
                registry, dispatcher, queue, progress, scheduler, clock, new ReportEvents());

        log.debug("Graph generator created, images in {}", scratchDirectory);
    }

    public void addListener(GraphListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GraphListener listener) {
        listeners.remove(listener);
    }

    // -------------------------------------------------------------------------
    // Renderer lifecycle

    /** Starts the renderer in its current working directory. */
    public void start() {
        scheduler.execute(() -> supervisor.start(null));
    }

    public void start(Path workingDirectory) {
        scheduler.execute(() -> supervisor.start(workingDirectory));
    }

    public void stop() {
        scheduler.execute(supervisor::stop);
    }

    /** Changes the renderer's working directory, in order with the commands already queued. */
    public void chdir(String dir) {
        Path path = Path.of(dir);
        scheduler.execute(() -> {
            supervisor.setWorkingDirectory(path);
            if (supervisor.state().isRunning()) {
                queue.enqueue("cd " + quote(path.toString()), response -> {
                    if (!response.success()) {
                        log.warn("Cannot change renderer directory to {}: {}", path, response.error());
                        fire(l -> l.rendererError(response.error()));
                    }
                });
            }
        });
    }

    // -------------------------------------------------------------------------
    // Queries

    /** {@code true} while the renderer accepts commands. */
    public boolean ready() {
        return ready;
    }

    /** Fraction of the current burst or report done, or a negative value when idle. */
    public double progress() {
        return progress.progress();
    }

    public boolean reporting() {
        return reporter.reporting();
    }

    /** Reflects registrations once the event loop has applied them. */
    public boolean isTypeRegistered(String type) {
        return registry.isRegistered(type);
    }

    /** Renderer state as last seen by the event loop. Intended for diagnostics. */
    public RendererState rendererState() {
        return supervisor.state();
    }

    // -------------------------------------------------------------------------
    // Cache

    public void setImageCacheTimeout(double timeoutSeconds) {
        Duration timeout = seconds(timeoutSeconds);
        scheduler.execute(() -> cache.setTimeout(timeout));
    }

    /** Removes expired images. Call periodically. */
    public void checkCache() {
        scheduler.execute(() -> cache.evictExpired(clock.instant()));
    }

    // -------------------------------------------------------------------------
    // Image types and styling

    public void registerImageType(String type, String commandTemplate) {
        registerImageType(type, commandTemplate, false, Map.of());
    }

    /**
     * Registers or replaces an image type.
     *
     * @param fullSizeOnly      render every request of this type in full-size mode
     * @param fontSizeOverrides font tag to size, applied on top of {@link #setFontSize}
     */
    public void registerImageType(String type, String commandTemplate, boolean fullSizeOnly,
                                  Map<String, Integer> fontSizeOverrides) {
        ImageType imageType = new ImageType(type, commandTemplate, fullSizeOnly, fontSizeOverrides);
        scheduler.execute(() -> registry.register(imageType));
    }

    /** Drops all registered image types and all images from the cache. */
    public void dropAllImageTypes() {
        scheduler.execute(() -> {
            registry.clear();
            dispatcher.dropAll();
        });
    }

    /** Sets a renderer font size; {@code tag} is a rrdtool FONTTAG such as DEFAULT or LEGEND. */
    public void setFontSize(String tag, int size) {
        RrdGraphCommandBuilder.checkFontSize(tag, size);
        scheduler.execute(() -> commandBuilder.setFontSize(tag, size));
    }

    public void setSingleLineColors(Color main, Color secondary) {
        scheduler.execute(() -> commandBuilder.setColors(main, secondary));
    }

    /** Applies the default single-line colors unless colors were set before. */
    public void setSingleLineColors() {
        scheduler.execute(commandBuilder::setDefaultColorsIfUnset);
    }

    // -------------------------------------------------------------------------
    // Images and reports

    /**
     * Asks for an image. A cached image is announced through
     * {@link GraphListener#newImage} only if its file differs from {@code currentFile};
     * otherwise the image is rendered and announced when ready.
     *
     * @param caller      id echoed back in {@link GraphListener#newImage}
     * @param currentFile file the caller displays now, or an empty string
     */
    public void getImage(int caller, String type, long from, long duration, PixelSize size,
                         boolean fullSize, String currentFile) {
        ImageRequest request = new ImageRequest(type, from, duration, size, fullSize);
        String current = currentFile == null ? "" : currentFile;
        scheduler.execute(() -> dispatcher.request(request, new ImageWaiter() {
            @Override
            public void imageReady(Path file) {
                if (file.toString().equals(current)) {
                    log.debug("Caller {} already shows {}", caller, file);
                    return;
                }
                fire(l -> l.newImage(caller, file));
            }

            @Override
            public void imageFailed(String error) {
                log.debug("Image for caller {} failed: {}", caller, error);
            }
        }));
    }

    /**
     * Generates a report: one full-size image per registered type, saved under a new
     * time-stamped directory in the configured report directory.
     */
    public void makeReport(long from, long duration, PixelSize size) {
        if (duration < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + duration);
        }
        if (size == null) {
            throw new IllegalArgumentException("Report image size must not be null");
        }
        scheduler.execute(() -> reporter.makeReport(from, duration, size));
    }

    // -------------------------------------------------------------------------
    // Shutdown

    /** Stops the renderer, deletes the cached images and stops the event loop. */
    @Override
    public void close() {
        scheduler.execute(() -> {
            supervisor.stop();
            cache.dropAll();
        });
        scheduler.shutdown();
        if (ownsScratchDirectory) {
            deleteRecursively(scratchDirectory);
        }
        log.info("Graph generator closed");
    }

    // -------------------------------------------------------------------------
    // Internals

    private void fire(Consumer<GraphListener> event) {
        for (GraphListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.error("Graph listener threw", e);
            }
        }
    }

    private static Duration seconds(double seconds) {
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new IllegalArgumentException("Timeout must not be negative: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private static String quote(String arg) {
        return "'" + arg.replace("'", "\\'") + "'";
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Cannot delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Cannot clean up {}: {}", root, e.getMessage());
        }
    }

    private final class SupervisorEvents implements ProcessSupervisor.Listener {

        @Override
        public void readyChanged(boolean isReady) {
            ready = isReady;
            if (isReady) {
                queue.pump();
            }
            fire(l -> l.readyChanged(isReady));
        }

        @Override
        public void outputLine(String line) {
            queue.outputLine(line);
        }

        @Override
        public void terminated(String diagnostic, boolean unexpected) {
            queue.failAll(diagnostic);
            if (unexpected) {
                fire(l -> l.rendererError(diagnostic));
            }
        }

        @Override
        public void launchFailed(String error) {
            fire(l -> l.rendererError(error));
        }
    }

    private final class ReportEvents implements ReportGenerator.Listener {

        @Override
        public void reportingChanged(boolean reporting) {
            fire(l -> l.reportingChanged(reporting));
        }

        @Override
        public void reportComplete(Path directory) {
            fire(l -> l.reportComplete(directory));
        }

        @Override
        public void reportError(String error) {
            fire(l -> l.rendererError(error));
        }
    }
}
