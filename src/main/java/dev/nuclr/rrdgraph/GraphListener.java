package dev.nuclr.rrdgraph;

import java.nio.file.Path;

/**
 * Observer of {@link GraphGenerator}. Every method is called on the generator's
 * event loop and must return quickly.
 */
public interface GraphListener {

    default void readyChanged(boolean ready) {}

    default void progressChanged(double progress) {}

    default void reportingChanged(boolean reporting) {}

    default void reportComplete(Path directory) {}

    default void rendererError(String errorText) {}

    /** {@code caller} is the id passed to {@link GraphGenerator#getImage}. */
    default void newImage(int caller, Path file) {}
}
