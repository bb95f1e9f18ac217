package org.iceforge.imagecache.cache;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Promotion cache over {@link DiskStore}. Not thread-safe: every call is made while holding
 * the owning {@link ProductImageCache}'s lock.
 */
final class MemoryStore<V> {

    private final Map<CacheKey, V> entries = new HashMap<>();
    private final ToLongFunction<V> sizer;
    private long bytes;

    MemoryStore(ToLongFunction<V> sizer) {
        this.sizer = sizer;
    }

    Optional<V> get(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    boolean contains(CacheKey key) {
        return entries.containsKey(key);
    }

    void put(CacheKey key, V value) {
        V previous = entries.put(key, value);
        if (previous != null) {
            bytes -= sizer.applyAsLong(previous);
        }
        bytes += sizer.applyAsLong(value);
    }

    /**
     * @return how many entries were removed
     */
    int removeIf(Predicate<CacheKey> predicate) {
        int removed = 0;
        Iterator<Map.Entry<CacheKey, V>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<CacheKey, V> e = it.next();
            if (predicate.test(e.getKey())) {
                bytes -= sizer.applyAsLong(e.getValue());
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    void clear() {
        entries.clear();
        bytes = 0;
    }

    int size() {
        return entries.size();
    }

    long bytes() {
        return bytes;
    }
}
