package dev.nuclr.rrdgraph.image;

import java.nio.file.Path;

/** Continuation of a dispatched image request. Exactly one method is called, once. */
public interface ImageWaiter {

    void imageReady(Path file);

    void imageFailed(String error);
}
