package org.iceforge.imagecache.cache;

public enum CacheEntryState {
    MISSING,
    DOWNLOADING,
    CACHED,
    FAILED;

    /**
     * Transitions only move forward, except {@code FAILED -> DOWNLOADING} (retry) and
     * {@code -> MISSING} (eviction).
     */
    public boolean canAdvanceTo(CacheEntryState next) {
        if (next == MISSING) {
            return this != MISSING;
        }
        return switch (this) {
            case MISSING -> next == DOWNLOADING || next == CACHED;
            case DOWNLOADING -> next == CACHED || next == FAILED;
            case CACHED -> false;
            case FAILED -> next == DOWNLOADING || next == CACHED;
        };
    }
}
