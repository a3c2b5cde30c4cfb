package dev.nuclr.rrdgraph.service;

/** Lifecycle of the renderer process as seen by {@link ProcessSupervisor}. */
public enum RendererState {
    STOPPED,
    STARTING,
    READY,
    BUSY,
    /** The process exited without being asked to. Behaves like {@link #STOPPED} until restarted. */
    CRASHED;

    public boolean isRunning() {
        return this == STARTING || this == READY || this == BUSY;
    }
}
