package org.iceforge.imagecache.cache;

/**
 * Lookup counters. A lookup answered from memory or disk is a hit; one that found nothing,
 * or only an unreadable file, is a miss.
 */
public interface CacheMetrics {
    long hits();
    long misses();

    /** Bytes currently promoted to memory. */
    long bytesUsed();

    default double hitRatio() {
        long total = hits() + misses();
        return total == 0 ? 0.0 : (double) hits() / total;
    }
}
