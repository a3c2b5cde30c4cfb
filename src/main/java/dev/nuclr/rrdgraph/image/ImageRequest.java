package dev.nuclr.rrdgraph.image;

import dev.nuclr.rrdgraph.cache.CacheKey;
import dev.nuclr.rrdgraph.service.PixelSize;

/**
 * One logical image request.
 *
 * @param from     start of the plotted range, seconds since the epoch
 * @param duration length of the plotted range in seconds
 */
public record ImageRequest(String type, long from, long duration, PixelSize size, boolean fullSize) {

    public ImageRequest {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Image type must not be blank");
        }
        if (duration < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + duration);
        }
        if (size == null) {
            throw new IllegalArgumentException("Size must not be null");
        }
    }

    public long to() {
        return from + duration;
    }

    public CacheKey cacheKey() {
        return new CacheKey(type, from, duration, size.width(), size.height(), fullSize);
    }

    /** Same request in full-size mode. */
    public ImageRequest asFullSize() {
        return fullSize ? this : new ImageRequest(type, from, duration, size, true);
    }
}
