package org.iceforge.imagecache.cache;

import java.nio.file.Path;

/**
 * Handle returned by a successful lookup: the artifact's bytes as loaded from disk.
 * <p>
 * The same handle is shared by every reader of a promoted key, so {@link #data()} hands out a
 * copy.
 */
public record CachedArtifact(CacheKey key, Path path, byte[] data) {

    @Override
    public byte[] data() {
        return data.clone();
    }

    public long sizeBytes() {
        return data.length;
    }
}
