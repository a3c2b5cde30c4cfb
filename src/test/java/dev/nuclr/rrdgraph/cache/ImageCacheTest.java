package dev.nuclr.rrdgraph.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.nuclr.rrdgraph.service.PixelSize;

class ImageCacheTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final CacheKey CPU = new CacheKey("cpu", 0, 3600, 200, 100, false);

    @TempDir
    Path dir;

    private ImageCache cache;

    @BeforeEach
    void setUp() {
        cache = new ImageCache(Duration.ofSeconds(120));
    }

    private CachedImage image(CacheKey key, String name, Instant created) throws Exception {
        Path file = Files.writeString(dir.resolve(name), "png");
        return new CachedImage(key, file, new PixelSize(200, 100), created);
    }

    @Test
    void entryIsKeptBeforeTimeout() throws Exception {
        CachedImage img = image(CPU, "a.png", T0);
        cache.insert(img);

        assertEquals(0, cache.evictExpired(T0.plusSeconds(119)));

        assertEquals(img, cache.lookup(CPU).orElseThrow());
        assertTrue(Files.exists(img.file()));
    }

    @Test
    void entryIsEvictedAtTimeoutAndFileDeleted() throws Exception {
        CachedImage img = image(CPU, "a.png", T0);
        cache.insert(img);

        assertEquals(1, cache.evictExpired(T0.plusSeconds(120)));

        assertTrue(cache.lookup(CPU).isEmpty());
        assertFalse(Files.exists(img.file()));
    }

    @Test
    void hitsDoNotExtendLifetime() throws Exception {
        cache.insert(image(CPU, "a.png", T0));

        cache.lookup(CPU);
        cache.lookup(CPU);

        cache.evictExpired(T0.plusSeconds(120));
        assertTrue(cache.lookup(CPU).isEmpty());
    }

    @Test
    void replacedFileSurvivesUntilItExpires() throws Exception {
        CachedImage old = image(CPU, "old.png", T0);
        CachedImage fresh = image(CPU, "new.png", T0.plusSeconds(60));
        cache.insert(old);

        cache.insert(fresh);

        assertEquals(fresh, cache.lookup(CPU).orElseThrow());
        assertTrue(Files.exists(old.file()), "a replaced file may still be on screen");

        cache.evictExpired(T0.plusSeconds(130));
        assertFalse(Files.exists(old.file()));
        assertTrue(Files.exists(fresh.file()));
        assertEquals(1, cache.size());
    }

    @Test
    void missingFileIsTreatedAsMiss() throws Exception {
        CachedImage img = image(CPU, "a.png", T0);
        cache.insert(img);
        Files.delete(img.file());

        assertTrue(cache.lookup(CPU).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void keysDifferingOnlyInSizeOrFullFlagAreDistinct() throws Exception {
        CacheKey bigger = new CacheKey("cpu", 0, 3600, 400, 200, false);
        CacheKey full = new CacheKey("cpu", 0, 3600, 200, 100, true);
        cache.insert(image(CPU, "a.png", T0));

        assertTrue(cache.lookup(bigger).isEmpty());
        assertTrue(cache.lookup(full).isEmpty());
        assertEquals(CPU, new CacheKey("cpu", 0, 3600, 200, 100, false));
    }

    @Test
    void dropAllDeletesEveryFile() throws Exception {
        CachedImage a = image(CPU, "a.png", T0);
        CachedImage b = image(new CacheKey("mem", 0, 3600, 200, 100, false), "b.png", T0);
        CachedImage orphan = image(new CacheKey("disk", 0, 60, 10, 10, false), "c.png", T0);
        cache.insert(a);
        cache.insert(b);
        cache.retire(orphan);

        cache.dropAll();

        assertEquals(0, cache.size());
        assertFalse(Files.exists(a.file()));
        assertFalse(Files.exists(b.file()));
        assertFalse(Files.exists(orphan.file()));
    }

    @Test
    void shorterTimeoutAppliesToExistingEntries() throws Exception {
        cache.insert(image(CPU, "a.png", T0));

        cache.setTimeout(Duration.ofSeconds(10));

        assertEquals(1, cache.evictExpired(T0.plusSeconds(10)));
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.setTimeout(Duration.ofSeconds(-1)));
    }
}
