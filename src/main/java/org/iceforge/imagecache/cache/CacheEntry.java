package org.iceforge.imagecache.cache;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Point-in-time view of what the cache knows about one key.
 *
 * @param diskPath  set once the artifact is {@link CacheEntryState#CACHED}
 * @param sizeBytes set once the artifact is {@link CacheEntryState#CACHED}
 * @param inMemory  whether a decoded copy is currently held in memory
 */
public record CacheEntry(
        CacheKey key,
        CacheEntryState state,
        Path diskPath,
        Long sizeBytes,
        boolean inMemory,
        Instant updatedAt
) {

    static CacheEntry downloading(CacheKey key) {
        return new CacheEntry(key, CacheEntryState.DOWNLOADING, null, null, false, Instant.now());
    }

    static CacheEntry cached(CacheKey key, Path diskPath, long sizeBytes) {
        return new CacheEntry(key, CacheEntryState.CACHED, diskPath, sizeBytes, false, Instant.now());
    }

    static CacheEntry failed(CacheKey key) {
        return new CacheEntry(key, CacheEntryState.FAILED, null, null, false, Instant.now());
    }

    CacheEntry withInMemory(boolean inMemory) {
        return new CacheEntry(key, state, diskPath, sizeBytes, inMemory, updatedAt);
    }
}
