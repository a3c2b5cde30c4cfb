package dev.nuclr.rrdgraph.service;

import java.io.IOException;

/** Write side of a running renderer process. */
public interface RendererConnection {

    /** Writes one command line to the renderer's standard input and flushes it. */
    void send(String command) throws IOException;

    boolean isAlive();

    /** Kills the process; the exit is still reported through {@link RendererOutput#exited(int)}. */
    void destroy();
}
