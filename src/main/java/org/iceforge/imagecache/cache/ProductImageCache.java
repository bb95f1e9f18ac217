package org.iceforge.imagecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.iceforge.imagecache.download.BatchDownloader;
import org.iceforge.imagecache.download.BatchListener;
import org.iceforge.imagecache.download.DownloadTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Two-level cache of per-product images: a memory promotion cache over the {@link DiskStore},
 * filled by a {@link BatchDownloader} and trimmed by page scope.
 * <p>
 * The memory stores, the entry table and the page scope are only touched while holding
 * {@code lock}. Disk reads and deletes happen outside it, so a slow read never blocks other
 * lookups. Nothing here throws on I/O failure: problems are logged and surface as a miss.
 */
public class ProductImageCache implements CacheMetrics {
    private static final Logger logger = LoggerFactory.getLogger(ProductImageCache.class);

    private final DiskStore disk;
    private final BatchDownloader downloader;
    private final ObjectMapper objectMapper;

    private final Object lock = new Object();
    private final MemoryStore<CachedArtifact> artifacts = new MemoryStore<>(CachedArtifact::sizeBytes);
    private final MemoryStore<JsonNode> sidecars = new MemoryStore<>(n -> 0L);
    private final Map<CacheKey, CacheEntry> entries = new HashMap<>();
    private final PageScope scope = new PageScope();
    // Bumped by every eviction; a promotion that started under an older generation is dropped.
    private long generation;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ProductImageCache(DiskStore disk, BatchDownloader downloader, ObjectMapper objectMapper) {
        this.disk = Objects.requireNonNull(disk);
        this.downloader = Objects.requireNonNull(downloader);
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    public Path root() {
        return disk.root();
    }

    // ----------------------------------------------------------------------
    // Batches
    // ----------------------------------------------------------------------

    /**
     * Hands {@code tasks} to the downloader, superseding any running batch.
     *
     * @return false only if the batch could not be started at all
     */
    public boolean startBatch(List<DownloadTask> tasks, BatchListener listener) {
        Objects.requireNonNull(tasks, "tasks");
        if (closed.get()) {
            logger.warn("Batch rejected: cache is shut down");
            return false;
        }
        // Marked before the worker starts so a fast FAILED/CACHED report is never overwritten.
        Map<CacheKey, CacheEntry> before = new HashMap<>();
        synchronized (lock) {
            for (DownloadTask t : tasks) {
                if (!before.containsKey(t.key())) {
                    before.put(t.key(), entries.get(t.key()));
                }
                advance(t.key(), CacheEntry.downloading(t.key()));
            }
        }
        boolean started = downloader.start(tasks, new TrackingListener(listener == null ? BatchListener.NOOP : listener));
        if (!started) {
            synchronized (lock) {
                before.forEach(this::restore);
            }
        }
        return started;
    }

    public boolean startBatch(List<DownloadTask> tasks,
                              BatchListener.Progress onProgress,
                              Runnable onDone,
                              Consumer<String> onError) {
        return startBatch(tasks, BatchListener.of(onProgress, onDone, onError));
    }

    public void stopBatch() {
        downloader.stop();
    }

    public boolean isBatchRunning() {
        return downloader.isRunning();
    }

    public boolean awaitBatch(Duration timeout) throws InterruptedException {
        return downloader.awaitIdle(timeout);
    }

    // ----------------------------------------------------------------------
    // Lookup
    // ----------------------------------------------------------------------

    public Optional<CachedArtifact> lookup(String entityId, String folder, String filename) {
        return lookup(CacheKey.of(entityId, folder, filename));
    }

    /**
     * Memory first, then disk (promoting on hit). A key whose download is still in flight is a
     * miss until the file has been moved into place.
     */
    public Optional<CachedArtifact> lookup(CacheKey key) {
        long gen;
        synchronized (lock) {
            Optional<CachedArtifact> mem = artifacts.get(key);
            if (mem.isPresent()) {
                hits.increment();
                return mem;
            }
            gen = generation;
        }

        Optional<byte[]> data = disk.read(key);
        if (data.isEmpty()) {
            misses.increment();
            return Optional.empty();
        }
        CachedArtifact artifact = new CachedArtifact(key, disk.pathFor(key), data.get());
        synchronized (lock) {
            if (gen == generation) {
                artifacts.put(key, artifact);
                advance(key, CacheEntry.cached(key, artifact.path(), artifact.sizeBytes()));
            }
        }
        hits.increment();
        return Optional.of(artifact);
    }

    /**
     * Parsed {@code {entityId}/meta.json}, if present and valid JSON.
     */
    public Optional<JsonNode> lookupCompanionMetadata(String entityId) {
        CacheKey key = CacheKey.sidecar(entityId);
        long gen;
        synchronized (lock) {
            Optional<JsonNode> mem = sidecars.get(key);
            if (mem.isPresent()) {
                hits.increment();
                return mem;
            }
            gen = generation;
        }

        Optional<byte[]> data = disk.read(key);
        if (data.isEmpty()) {
            misses.increment();
            return Optional.empty();
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(data.get());
        } catch (IOException e) {
            logger.warn("Ignoring unreadable sidecar for entity {}: {}", entityId, e.getMessage());
            misses.increment();
            return Optional.empty();
        }
        synchronized (lock) {
            if (gen == generation) {
                sidecars.put(key, json);
                advance(key, CacheEntry.cached(key, disk.pathFor(key), data.get().length));
            }
        }
        hits.increment();
        return Optional.of(json);
    }

    public Optional<CacheEntry> entry(CacheKey key) {
        synchronized (lock) {
            CacheEntry e = entries.get(key);
            if (e == null) return Optional.empty();
            return Optional.of(e.withInMemory(artifacts.contains(key) || sidecars.contains(key)));
        }
    }

    /** Cached artifacts of one entity, by folder. Reads the disk directly. */
    public Map<String, List<CachedFile>> listCached(String entityId) {
        return disk.listEntity(requireEntityId(entityId));
    }

    public boolean isEntityCached(String entityId) {
        return !listCached(entityId).isEmpty();
    }

    // ----------------------------------------------------------------------
    // Scope and eviction
    // ----------------------------------------------------------------------

    public void setPageScope(Collection<String> entityIds) {
        Objects.requireNonNull(entityIds, "entityIds");
        entityIds.forEach(ProductImageCache::requireEntityId);
        synchronized (lock) {
            scope.replace(entityIds);
        }
        logger.debug("Page scope set to {} entit(ies)", entityIds.size());
    }

    public Set<String> pageScope() {
        synchronized (lock) {
            return scope.snapshot();
        }
    }

    /**
     * Drops everything whose entity is not in the current page scope, from memory and disk.
     * Entities that still have pending tasks in the running batch are left on disk.
     *
     * @return how many entity directories were deleted
     */
    public int evictOutsideScope() {
        Set<String> inScope;
        int fromMemory;
        synchronized (lock) {
            inScope = scope.snapshot();
            fromMemory = purge(k -> !inScope.contains(k.entityId()));
        }

        Set<String> deleted = sweep(disk.entityIds().stream().filter(id -> !inScope.contains(id)).toList());

        synchronized (lock) {
            purge(k -> deleted.contains(k.entityId()));
        }
        logger.info("Evicted {} entit(ies) outside page scope of {} ({} memory entr(ies))",
                deleted.size(), inScope.size(), fromMemory);
        return deleted.size();
    }

    /**
     * Drops the given entities from memory and disk. Entities in the current page scope are
     * never evicted.
     *
     * @return how many entity directories were deleted
     */
    public int evict(Collection<String> entityIds) {
        Objects.requireNonNull(entityIds, "entityIds");
        entityIds.forEach(ProductImageCache::requireEntityId);
        Set<String> targets;
        synchronized (lock) {
            targets = new LinkedHashSet<>(entityIds);
            targets.removeIf(scope::contains);
            Set<String> t = targets;
            purge(k -> t.contains(k.entityId()));
        }

        Set<String> deleted = sweep(targets);

        synchronized (lock) {
            purge(k -> deleted.contains(k.entityId()));
        }
        logger.info("Evicted {} of {} requested entit(ies)", deleted.size(), entityIds.size());
        return deleted.size();
    }

    /**
     * Cancels any running batch, empties memory and scope, and recreates an empty cache root.
     */
    public void clearAll() {
        downloader.cancelAndWait();
        synchronized (lock) {
            artifacts.clear();
            sidecars.clear();
            entries.clear();
            scope.clear();
            generation++;
        }
        disk.deleteAll();
        synchronized (lock) {
            // Promotions that raced the delete.
            artifacts.clear();
            sidecars.clear();
            generation++;
        }
        logger.info("Image cache cleared: {}", disk.root());
    }

    // ----------------------------------------------------------------------
    // Stats and lifecycle
    // ----------------------------------------------------------------------

    public CacheStats stats() {
        DiskStore.DiskUsage usage = disk.usage();
        int memoryEntries;
        synchronized (lock) {
            memoryEntries = artifacts.size() + sidecars.size();
        }
        return new CacheStats(usage.entityCount(), usage.fileCount(), usage.totalBytes(), memoryEntries);
    }

    @Override
    public long hits() {
        return hits.sum();
    }

    @Override
    public long misses() {
        return misses.sum();
    }

    /** Bytes held by the memory store. */
    @Override
    public long bytesUsed() {
        synchronized (lock) {
            return artifacts.bytes();
        }
    }

    /**
     * Cancels any running batch and releases the worker. Safe to call more than once.
     */
    @PreDestroy
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        downloader.shutdown();
        synchronized (lock) {
            artifacts.clear();
            sidecars.clear();
        }
        logger.info("Image cache shut down");
    }

    // ----------------------------------------------------------------------
    // Internals
    // ----------------------------------------------------------------------

    /** Caller holds {@code lock}. */
    private int purge(Predicate<CacheKey> doomed) {
        generation++;
        entries.keySet().removeIf(doomed);
        return artifacts.removeIf(doomed) + sidecars.removeIf(doomed);
    }

    private Set<String> sweep(Collection<String> candidates) {
        Set<String> inFlight = downloader.inFlightEntityIds();
        Set<String> deleted = new LinkedHashSet<>();
        for (String entityId : candidates) {
            if (inFlight.contains(entityId)) {
                logger.info("Keeping entity {} on disk: running batch still has tasks for it", entityId);
                continue;
            }
            if (disk.deleteEntity(entityId)) {
                deleted.add(entityId);
            }
        }
        return deleted;
    }

    /** Caller holds {@code lock}. */
    private void advance(CacheKey key, CacheEntry next) {
        CacheEntry current = entries.get(key);
        CacheEntryState from = current == null ? CacheEntryState.MISSING : current.state();
        if (from.canAdvanceTo(next.state())) {
            entries.put(key, next);
        }
    }

    /** Caller holds {@code lock}. Undoes a DOWNLOADING mark for a batch that never ran. */
    private void restore(CacheKey key, CacheEntry previous) {
        CacheEntry current = entries.get(key);
        if (current == null || current.state() != CacheEntryState.DOWNLOADING) {
            return;
        }
        if (previous == null) {
            entries.remove(key);
        } else {
            entries.put(key, previous);
        }
    }

    private static String requireEntityId(String entityId) {
        // Reuses the key's segment rules.
        return CacheKey.sidecar(entityId).entityId();
    }

    private final class TrackingListener implements BatchListener {
        private final BatchListener delegate;

        private TrackingListener(BatchListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onItemAvailable(DownloadTask task, Path path) {
            long size = path.toFile().length();
            synchronized (lock) {
                advance(task.key(), CacheEntry.cached(task.key(), path, size));
            }
            delegate.onItemAvailable(task, path);
        }

        @Override
        public void onItemFailed(DownloadTask task, Exception cause) {
            synchronized (lock) {
                advance(task.key(), CacheEntry.failed(task.key()));
            }
            delegate.onItemFailed(task, cause);
        }

        @Override
        public void onProgress(int done, int total) {
            delegate.onProgress(done, total);
        }

        @Override
        public void onDone() {
            delegate.onDone();
        }

        @Override
        public void onError(String message) {
            delegate.onError(message);
        }
    }
}
