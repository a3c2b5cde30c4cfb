package dev.nuclr.rrdgraph.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import dev.nuclr.rrdgraph.config.GraphGeneratorConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the single renderer process.
 *
 * <p>States: {@code STOPPED -> STARTING -> READY <-> BUSY}; an unexpected exit from
 * any running state leads to {@code CRASHED}. The supervisor never restarts the
 * renderer on its own; callers invoke {@link #start(Path)} again.
 *
 * <p>Output and exit events arrive on the launcher's reader thread and are
 * re-posted to the {@link EventScheduler}. Events of a process that has already
 * been replaced or stopped are dropped by comparing launch generations.
 *
 * <p>Not thread-safe: every method must be called on the event loop.
 */
@Slf4j
public final class ProcessSupervisor {

    /** Receives supervisor events on the event loop. */
    public interface Listener {

        void readyChanged(boolean ready);

        void outputLine(String line);

        /**
         * The renderer is gone.
         *
         * @param diagnostic human readable reason, including the captured output tail on a crash
         * @param unexpected {@code true} if the process exited without {@link #stop()}
         */
        void terminated(String diagnostic, boolean unexpected);

        void launchFailed(String error);
    }

    private final GraphGeneratorConfig config;
    private final RendererLauncher launcher;
    private final RendererLocator locator;
    private final EventScheduler scheduler;
    private final Listener listener;

    private final Deque<String> outputTail = new ArrayDeque<>();

    private RendererState state = RendererState.STOPPED;
    private RendererConnection connection;
    private Path workingDirectory;
    private long generation;

    public ProcessSupervisor(GraphGeneratorConfig config, RendererLauncher launcher,
                             RendererLocator locator, EventScheduler scheduler, Listener listener) {
        this.config = config;
        this.launcher = launcher;
        this.locator = locator;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    // -------------------------------------------------------------------------
    // Lifecycle

    /**
     * Launches the renderer in {@code dir} (or the last directory set, if {@code null}).
     * A running renderer is left alone.
     */
    public void start(Path dir) {
        if (state.isRunning()) {
            log.debug("Renderer already running ({}), start ignored", state);
            return;
        }
        if (dir != null) {
            workingDirectory = dir;
        }

        List<String> command = buildLaunchCommand();
        long launchId = ++generation;
        outputTail.clear();

        try {
            connection = launcher.launch(command, workingDirectory, new Output(launchId));
        } catch (IOException e) {
            connection = null;
            state = RendererState.STOPPED;
            log.error("Failed to start renderer {}: {}", command, e.getMessage());
            listener.launchFailed("Failed to start renderer: " + e.getMessage());
            return;
        }

        state = RendererState.STARTING;
        log.info("Renderer starting: {}", command);
        scheduler.execute(() -> started(launchId));
    }

    /** Stops the renderer. Its exit is not reported as a crash. */
    public void stop() {
        if (!state.isRunning()) {
            return;
        }
        generation++;
        RendererConnection c = connection;
        connection = null;
        boolean wasReady = isReady();
        state = RendererState.STOPPED;
        c.destroy();
        log.info("Renderer stopped");

        if (wasReady) {
            listener.readyChanged(false);
        }
        listener.terminated("Renderer stopped", false);
    }

    private void started(long launchId) {
        if (launchId != generation || state != RendererState.STARTING) {
            return;
        }
        state = RendererState.READY;
        log.info("Renderer ready");
        listener.readyChanged(true);
    }

    private void outputLine(long launchId, String line) {
        if (launchId != generation) {
            return;
        }
        outputTail.addLast(line);
        while (outputTail.size() > Math.max(1, config.getCrashOutputLines())) {
            outputTail.removeFirst();
        }
        listener.outputLine(line);
    }

    private void exited(long launchId, int exitCode) {
        if (launchId != generation || !state.isRunning()) {
            return;
        }
        boolean wasReady = isReady();
        connection = null;
        state = RendererState.CRASHED;

        String diagnostic = "Renderer exited unexpectedly with code " + exitCode
                + (outputTail.isEmpty() ? "" : ":\n" + String.join("\n", outputTail));
        log.error("{}", diagnostic);

        if (wasReady) {
            listener.readyChanged(false);
        }
        listener.terminated(diagnostic, true);
    }

    // -------------------------------------------------------------------------
    // Command traffic

    /**
     * Writes a command to the renderer and marks it busy.
     *
     * @throws IllegalStateException if the renderer is not {@code READY}
     * @throws IOException           if the pipe is broken
     */
    public void send(String command) throws IOException {
        if (state != RendererState.READY) {
            throw new IllegalStateException("Renderer is not ready: " + state);
        }
        state = RendererState.BUSY;
        log.debug("-> {}", command);
        connection.send(command);
    }

    /** Called by the queue once the answer to the last {@link #send(String)} arrived. */
    public void commandDone() {
        if (state == RendererState.BUSY) {
            state = RendererState.READY;
        }
    }

    // -------------------------------------------------------------------------
    // Queries

    public RendererState state() {
        return state;
    }

    /** {@code true} while the renderer accepts commands, including while it renders one. */
    public boolean isReady() {
        return state == RendererState.READY || state == RendererState.BUSY;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    /** Remembers the directory for the next launch; a running renderer is moved with a {@code cd} command. */
    public void setWorkingDirectory(Path dir) {
        this.workingDirectory = dir;
    }

    private List<String> buildLaunchCommand() {
        List<String> command = new ArrayList<>();
        command.add(locator.locate());
        String args = config.getRendererArguments();
        if (args != null && !args.isBlank()) {
            command.addAll(Arrays.asList(args.trim().split("\\s+")));
        }
        return command;
    }

    /** Bridges reader-thread callbacks onto the event loop. */
    private final class Output implements RendererOutput {

        private final long launchId;

        Output(long launchId) {
            this.launchId = launchId;
        }

        @Override
        public void line(String line) {
            scheduler.execute(() -> outputLine(launchId, line));
        }

        @Override
        public void exited(int exitCode) {
            scheduler.execute(() -> ProcessSupervisor.this.exited(launchId, exitCode));
        }
    }
}
