package org.iceforge.imagecache.cache;

/**
 * Derived on demand from a disk walk plus the memory store size. Never persisted.
 */
public record CacheStats(
        int entityCount,
        long fileCount,
        long totalBytes,
        int memoryEntryCount
) {}
