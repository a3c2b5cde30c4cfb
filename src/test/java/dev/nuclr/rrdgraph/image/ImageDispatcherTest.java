package dev.nuclr.rrdgraph.image;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.nuclr.rrdgraph.service.PixelSize;

/**
 * Size handling of {@link ImageDispatcher}; request flow is covered by
 * {@link dev.nuclr.rrdgraph.GraphGeneratorTest}.
 */
class ImageDispatcherTest {

    private static ImageRequest thumb(int w, int h) {
        return new ImageRequest("cpu", 0, 3600, new PixelSize(w, h), false);
    }

    @Test
    void requestedSizeIsUsedUntilFullSizeIsKnown() {
        assertEquals(new PixelSize(200, 100), ImageDispatcher.renderSize(null, thumb(200, 100)));
    }

    @Test
    void thumbnailsFollowFullSizeAspectRatio() {
        PixelSize full = new PixelSize(800, 200);

        assertEquals(new PixelSize(200, 50), ImageDispatcher.renderSize(full, thumb(200, 100)));
    }

    @Test
    void thumbnailNeverGrowsTallerThanRequested() {
        PixelSize full = new PixelSize(100, 400);

        assertEquals(new PixelSize(200, 100), ImageDispatcher.renderSize(full, thumb(200, 100)));
    }

    @Test
    void fullSizeRequestsKeepRequestedSize() {
        PixelSize full = new PixelSize(800, 200);
        ImageRequest request = new ImageRequest("cpu", 0, 3600, new PixelSize(640, 480), true);

        assertEquals(new PixelSize(640, 480), ImageDispatcher.renderSize(full, request));
    }

    @Test
    void fullSizeOutlivesReRegistration() {
        ImageTypeRegistry registry = new ImageTypeRegistry();
        registry.register(new ImageType("cpu", "LINE1:a#${color_main}", false, Map.of()));
        registry.recordFullImagePixelSize("cpu", new PixelSize(800, 200));

        registry.register(new ImageType("cpu", "LINE2:a#${color_main}", false, Map.of()));
        assertEquals(new PixelSize(800, 200), registry.fullImagePixelSize("cpu"));

        registry.clear();
        assertNull(registry.fullImagePixelSize("cpu"));
    }

    @Test
    void equalRequestsShareCacheKey() {
        assertEquals(thumb(200, 100).cacheKey(), thumb(200, 100).cacheKey());
        assertNotEquals(thumb(200, 100).cacheKey(), thumb(201, 100).cacheKey());
        assertNotEquals(thumb(200, 100).cacheKey(), thumb(200, 100).asFullSize().cacheKey());
    }

    @Test
    void invalidRequestsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ImageRequest("", 0, 1, new PixelSize(1, 1), false));
        assertThrows(IllegalArgumentException.class, () -> new ImageRequest("cpu", 0, -1, new PixelSize(1, 1), false));
        assertThrows(IllegalArgumentException.class, () -> new PixelSize(0, 10));
    }
}
