package dev.nuclr.rrdgraph.service;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Serialises commands onto the single renderer pipe.
 *
 * <p>At most one command is in flight. Answers carry no request id, so the
 * renderer's output is always attributed to the in-flight command; the next
 * command is written only after the current answer is terminated.
 *
 * <p>Not thread-safe: every method must be called on the event loop.
 */
@Slf4j
public final class CommandQueue {

    private final ProcessSupervisor supervisor;

    private final Deque<Command> pending = new ArrayDeque<>();
    private final List<String> response = new ArrayList<>();

    private Command inFlight;
    private long nextSequenceId;

    public CommandQueue(ProcessSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    /**
     * Appends a command. If the renderer is not running the command fails at once;
     * while it is starting the command waits.
     */
    public Command enqueue(String text, Consumer<RenderResponse> onComplete) {
        Command command = new Command(++nextSequenceId, text, onComplete);
        if (!supervisor.state().isRunning()) {
            log.debug("Renderer not running, failing command #{}", command.sequenceId());
            complete(command, RenderResponse.failure("Renderer is not running"));
            return command;
        }
        pending.addLast(command);
        pump();
        return command;
    }

    /** Promotes the head of the queue if the renderer is idle. */
    public void pump() {
        while (inFlight == null && !pending.isEmpty() && supervisor.state() == RendererState.READY) {
            Command next = pending.pollFirst();
            inFlight = next;
            response.clear();
            try {
                supervisor.send(next.text());
            } catch (IOException e) {
                log.warn("Cannot write command #{} to renderer: {}", next.sequenceId(), e.getMessage());
                inFlight = null;
                supervisor.commandDone();
                complete(next, RenderResponse.failure("Cannot write to renderer: " + e.getMessage()));
            }
        }
    }

    /** Feeds one renderer output line; a terminating line resolves the in-flight command. */
    public void outputLine(String line) {
        if (inFlight == null) {
            log.debug("Unsolicited renderer output: {}", line);
            return;
        }
        response.add(line);
        if (!ResponseParser.isTerminator(line)) {
            return;
        }

        RenderResponse result = ResponseParser.parse(List.copyOf(response));
        Command done = inFlight;
        inFlight = null;
        response.clear();
        supervisor.commandDone();

        if (!result.success()) {
            log.debug("Command #{} failed: {}", done.sequenceId(), result.error());
        }
        complete(done, result);
        pump();
    }

    /** Fails the in-flight command and every queued one. */
    public void failAll(String reason) {
        List<Command> doomed = new ArrayList<>();
        if (inFlight != null) {
            doomed.add(inFlight);
            inFlight = null;
        }
        doomed.addAll(pending);
        pending.clear();
        response.clear();

        if (!doomed.isEmpty()) {
            log.warn("Failing {} renderer command(s): {}", doomed.size(), reason);
        }
        for (Command c : doomed) {
            complete(c, RenderResponse.failure(reason));
        }
    }

    public int inFlightCount() {
        return inFlight == null ? 0 : 1;
    }

    public int queuedCount() {
        return pending.size();
    }

    /** {@code true} when nothing is queued and nothing is in flight. */
    public boolean isIdle() {
        return inFlight == null && pending.isEmpty();
    }

    private static void complete(Command command, RenderResponse result) {
        try {
            command.onComplete().accept(result);
        } catch (RuntimeException e) {
            log.error("Completion of command #{} threw", command.sequenceId(), e);
        }
    }
}
