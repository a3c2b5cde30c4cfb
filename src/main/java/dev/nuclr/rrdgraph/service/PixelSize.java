package dev.nuclr.rrdgraph.service;

/**
 * Width and height of an image in pixels.
 */
public record PixelSize(int width, int height) {

    public PixelSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Pixel size must be positive: " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
