package dev.nuclr.rrdgraph.image;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import dev.nuclr.rrdgraph.service.PixelSize;
import lombok.extern.slf4j.Slf4j;

/**
 * Registered image types in registration order. Re-registering a name replaces
 * the type but keeps its position and its recorded full-size pixel size.
 */
@Slf4j
public final class ImageTypeRegistry {

    private final Map<String, ImageType> types = new LinkedHashMap<>();

    // pixel size of the last full-size render per type name; outlives re-registration
    private final Map<String, PixelSize> fullSizes = new HashMap<>();

    public synchronized void register(ImageType type) {
        ImageType previous = types.put(type.getName(), type);
        if (previous != null) {
            log.debug("Image type '{}' re-registered", type.getName());
        }
    }

    public synchronized boolean isRegistered(String name) {
        return types.containsKey(name);
    }

    public synchronized Optional<ImageType> get(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /** Snapshot of the registered names, in registration order. */
    public synchronized List<String> names() {
        return List.copyOf(types.keySet());
    }

    public synchronized int size() {
        return types.size();
    }

    /** Pixel size of the last full-size render of {@code name}, or {@code null} if none was seen. */
    public synchronized PixelSize fullImagePixelSize(String name) {
        return fullSizes.get(name);
    }

    public synchronized void recordFullImagePixelSize(String name, PixelSize size) {
        fullSizes.put(name, size);
    }

    /** Forgets every type together with the recorded full-size pixel sizes. */
    public synchronized void clear() {
        types.clear();
        fullSizes.clear();
    }
}
