package dev.nuclr.rrdgraph.cache;

/**
 * Identity of a logical image request. Two requests with equal keys resolve to the
 * same cached image, and to the same render while one is pending.
 */
public record CacheKey(String type, long from, long duration, int width, int height, boolean fullSize) {

    @Override
    public String toString() {
        return type + "@" + from + "+" + duration + ":" + width + "x" + height + (fullSize ? ":full" : "");
    }
}
