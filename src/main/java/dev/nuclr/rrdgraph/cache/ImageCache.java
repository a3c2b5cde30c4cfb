package dev.nuclr.rrdgraph.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps {@link CacheKey}s to rendered image files and expires them after a fixed
 * time to live. Hits do not extend the lifetime of an entry.
 *
 * <p>Files of replaced entries are not deleted on {@link #insert}; a caller may
 * still display them. They are retired and removed by the next sweep that finds
 * them expired.
 *
 * <p>Not thread-safe: every method must be called on the event loop.
 */
@Slf4j
public final class ImageCache {

    private final Map<CacheKey, CachedImage> entries = new HashMap<>();
    private final List<CachedImage> retired = new ArrayList<>();

    private Duration timeout;

    public ImageCache(Duration timeout) {
        setTimeout(timeout);
    }

    public void setTimeout(Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Cache timeout must not be negative: " + timeout);
        }
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the entry for {@code key}. An entry whose file has disappeared is
     * dropped and reported as a miss so that the image gets rendered again.
     */
    public Optional<CachedImage> lookup(CacheKey key) {
        CachedImage image = entries.get(key);
        if (image == null) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(image.file())) {
            log.warn("Cached file {} for {} is gone, treating as miss", image.file(), key);
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(image);
    }

    public void insert(CachedImage image) {
        CachedImage previous = entries.put(image.key(), image);
        if (previous != null && !previous.file().equals(image.file())) {
            retired.add(previous);
        }
    }

    /**
     * Keeps an orphaned file until it expires. Used for renders whose result can no
     * longer be cached, e.g. after all image types were dropped.
     */
    public void retire(CachedImage image) {
        retired.add(image);
    }

    /**
     * Removes every entry with {@code now - createdAt >= timeout} and deletes its file.
     *
     * @return number of files removed
     */
    public int evictExpired(Instant now) {
        int removed = 0;
        Iterator<CachedImage> it = entries.values().iterator();
        while (it.hasNext()) {
            CachedImage image = it.next();
            if (isExpired(image, now)) {
                it.remove();
                deleteFile(image.file());
                removed++;
            }
        }
        Iterator<CachedImage> old = retired.iterator();
        while (old.hasNext()) {
            CachedImage image = old.next();
            if (isExpired(image, now)) {
                old.remove();
                deleteFile(image.file());
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} expired image(s), {} left", removed, entries.size());
        }
        return removed;
    }

    /** Deletes every cached and retired file and empties the cache. */
    public void dropAll() {
        for (CachedImage image : entries.values()) {
            deleteFile(image.file());
        }
        for (CachedImage image : retired) {
            deleteFile(image.file());
        }
        log.debug("Dropped {} cached image(s)", entries.size() + retired.size());
        entries.clear();
        retired.clear();
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(CachedImage image, Instant now) {
        return Duration.between(image.createdAt(), now).compareTo(timeout) >= 0;
    }

    private static void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete cached image {}: {}", file, e.getMessage());
        }
    }
}
