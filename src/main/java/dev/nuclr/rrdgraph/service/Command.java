package dev.nuclr.rrdgraph.service;

import java.util.function.Consumer;

/**
 * One line for the renderer plus the continuation that receives its answer.
 * {@link CommandQueue} invokes {@code onComplete} exactly once.
 */
public record Command(long sequenceId, String text, Consumer<RenderResponse> onComplete) {}
