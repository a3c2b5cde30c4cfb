package dev.nuclr.rrdgraph.image;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import dev.nuclr.rrdgraph.cache.CacheKey;
import dev.nuclr.rrdgraph.cache.CachedImage;
import dev.nuclr.rrdgraph.cache.ImageCache;
import dev.nuclr.rrdgraph.service.CommandQueue;
import dev.nuclr.rrdgraph.service.PixelSize;
import dev.nuclr.rrdgraph.service.RenderResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves image requests from the cache or by rendering them.
 *
 * <p>Requests with equal {@link CacheKey}s issued while a render for that key is
 * queued or in flight share the render: their waiters are attached to the
 * pending entry and all of them are notified when it completes.
 *
 * <p>Not thread-safe: every method must be called on the event loop.
 */
@Slf4j
public final class ImageDispatcher {

    private final ImageTypeRegistry registry;
    private final ImageCache cache;
    private final CommandQueue queue;
    private final CommandBuilder builder;
    private final ProgressTracker progress;
    private final Clock clock;
    private final Path scratchDirectory;
    private final Consumer<String> errors;

    private final Map<CacheKey, List<ImageWaiter>> pending = new HashMap<>();

    private long nextImageIndex;
    // bumped when all types are dropped; renders of older generations are not cached
    private long typeGeneration;

    public ImageDispatcher(ImageTypeRegistry registry, ImageCache cache, CommandQueue queue,
                           CommandBuilder builder, ProgressTracker progress, Clock clock,
                           Path scratchDirectory, Consumer<String> errors) {
        this.registry = registry;
        this.cache = cache;
        this.queue = queue;
        this.builder = builder;
        this.progress = progress;
        this.clock = clock;
        this.scratchDirectory = scratchDirectory;
        this.errors = errors;
    }

    /**
     * Resolves {@code request} and calls {@code waiter} exactly once, either right
     * away (cache hit, unknown type, renderer down) or when the render completes.
     */
    public void request(ImageRequest request, ImageWaiter waiter) {
        Optional<ImageType> found = registry.get(request.type());
        if (found.isEmpty()) {
            String error = "Image type '" + request.type() + "' is not registered";
            log.warn("{}", error);
            errors.accept(error);
            waiter.imageFailed(error);
            return;
        }
        ImageType type = found.get();
        ImageRequest effective = type.isFullSizeOnly() ? request.asFullSize() : request;
        CacheKey key = effective.cacheKey();

        cache.evictExpired(clock.instant());
        Optional<CachedImage> cached = cache.lookup(key);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", key);
            waiter.imageReady(cached.get().file());
            return;
        }

        List<ImageWaiter> waiters = pending.get(key);
        if (waiters != null) {
            log.debug("Joining pending render of {}", key);
            waiters.add(waiter);
            return;
        }
        waiters = new ArrayList<>();
        waiters.add(waiter);
        pending.put(key, waiters);

        Path file = scratchDirectory.resolve("image-" + (++nextImageIndex) + ".png");
        PixelSize size = renderSize(registry.fullImagePixelSize(type.getName()), effective);
        String command = builder.build(type, effective, size, file);
        long generation = typeGeneration;

        progress.requestIssued();
        queue.enqueue(command, response -> completed(key, type, file, generation, response));
    }

    /** Drops every cached image; renders still pending are delivered but no longer cached. */
    public void dropAll() {
        typeGeneration++;
        cache.dropAll();
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Thumbnails follow the aspect ratio {@code full} of the last full-size render of
     * their type, never growing beyond the requested height.
     */
    static PixelSize renderSize(PixelSize full, ImageRequest request) {
        if (request.fullSize() || full == null) {
            return request.size();
        }
        int width = request.size().width();
        long height = Math.round((double) width * full.height() / full.width());
        height = Math.max(1, Math.min(height, request.size().height()));
        return new PixelSize(width, (int) height);
    }

    private void completed(CacheKey key, ImageType type, Path file, long generation, RenderResponse response) {
        List<ImageWaiter> waiters = pending.remove(key);
        if (waiters == null) {
            waiters = List.of();
        }
        progress.requestResolved();

        RenderResponse result = response;
        if (result.success() && !Files.isRegularFile(file)) {
            result = RenderResponse.failure("Renderer reported success but wrote no file: " + file);
        }

        if (!result.success()) {
            log.warn("Rendering {} failed: {}", key, result.error());
            errors.accept(result.error());
            for (ImageWaiter w : waiters) {
                w.imageFailed(result.error());
            }
            return;
        }

        CachedImage image = new CachedImage(key, file, result.pixelSize(), clock.instant());
        if (generation == typeGeneration) {
            cache.insert(image);
            if (key.fullSize() && result.pixelSize() != null) {
                registry.recordFullImagePixelSize(type.getName(), result.pixelSize());
            }
        } else {
            cache.retire(image);
        }

        log.debug("Rendered {} -> {} for {} waiter(s)", key, file, waiters.size());
        for (ImageWaiter w : waiters) {
            w.imageReady(file);
        }
    }
}
