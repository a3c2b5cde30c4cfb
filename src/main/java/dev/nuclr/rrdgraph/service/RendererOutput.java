package dev.nuclr.rrdgraph.service;

/**
 * Receives what the renderer writes. Called from the launcher's reader thread;
 * implementations hand the events over to the event loop.
 */
public interface RendererOutput {

    void line(String line);

    void exited(int exitCode);
}
