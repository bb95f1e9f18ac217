package org.iceforge.imagecache.download;

import org.iceforge.imagecache.cache.CacheKey;

import java.time.Instant;
import java.util.Objects;

/**
 * One artifact to fetch into the disk store.
 *
 * @param sourceUrl   usually a presigned GET URL with limited validity
 * @param expiresHint when {@code sourceUrl} stops working, if known; informational only
 */
public record DownloadTask(CacheKey key, String sourceUrl, Instant expiresHint) {

    public DownloadTask {
        Objects.requireNonNull(key, "key");
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("sourceUrl is blank for " + key);
        }
    }

    public static DownloadTask of(String entityId, String folder, String filename, String sourceUrl) {
        return new DownloadTask(CacheKey.of(entityId, folder, filename), sourceUrl, null);
    }

    public boolean isExpired(Instant now) {
        return expiresHint != null && now.isAfter(expiresHint);
    }

    @Override
    public String toString() {
        // sourceUrl carries a signature; keep it out of logs.
        return "DownloadTask[" + key + "]";
    }
}
