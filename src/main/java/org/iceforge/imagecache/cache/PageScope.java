package org.iceforge.imagecache.cache;

import java.util.Collection;
import java.util.Set;

/**
 * Entities currently paged in. Replaced wholesale on every page change, never merged.
 * Guarded by the owning {@link ProductImageCache}'s lock.
 */
final class PageScope {

    private Set<String> entityIds = Set.of();

    void replace(Collection<String> ids) {
        this.entityIds = Set.copyOf(ids);
    }

    boolean contains(String entityId) {
        return entityIds.contains(entityId);
    }

    Set<String> snapshot() {
        return entityIds;
    }

    void clear() {
        entityIds = Set.of();
    }
}
