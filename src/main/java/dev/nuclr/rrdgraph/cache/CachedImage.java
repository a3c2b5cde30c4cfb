package dev.nuclr.rrdgraph.cache;

import java.nio.file.Path;
import java.time.Instant;

import dev.nuclr.rrdgraph.service.PixelSize;

/**
 * A rendered image owned by {@link ImageCache}.
 *
 * @param pixelSize size reported by the renderer, or {@code null} if it reported none
 */
public record CachedImage(CacheKey key, Path file, PixelSize pixelSize, Instant createdAt) {}
