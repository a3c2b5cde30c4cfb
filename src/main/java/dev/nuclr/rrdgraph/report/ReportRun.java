package dev.nuclr.rrdgraph.report;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import dev.nuclr.rrdgraph.service.PixelSize;
import lombok.Getter;

/**
 * State of one report run. Types are consumed front to back.
 */
@Getter
public final class ReportRun {

    private final long id;
    private final long from;
    private final long duration;
    private final PixelSize size;
    private final Path outputDirectory;
    private final int totalCount;

    private final Deque<String> remaining;
    private int completedCount;

    ReportRun(long id, long from, long duration, PixelSize size, Path outputDirectory, List<String> types) {
        this.id = id;
        this.from = from;
        this.duration = duration;
        this.size = size;
        this.outputDirectory = outputDirectory;
        this.remaining = new ArrayDeque<>(types);
        this.totalCount = types.size();
    }

    String nextType() {
        return remaining.pollFirst();
    }

    boolean hasRemaining() {
        return !remaining.isEmpty();
    }

    int markCompleted() {
        return ++completedCount;
    }

    boolean isDone() {
        return remaining.isEmpty() && completedCount >= totalCount;
    }
}
