package dev.nuclr.rrdgraph.image;

import java.nio.file.Path;

import dev.nuclr.rrdgraph.service.PixelSize;

/**
 * Turns an image request into the renderer command that writes {@code output}.
 */
public interface CommandBuilder {

    /**
     * @param renderSize size to ask the renderer for; may differ from the requested size
     */
    String build(ImageType type, ImageRequest request, PixelSize renderSize, Path output);
}
