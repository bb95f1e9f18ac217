package org.iceforge.imagecache.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.imagecache.cache.CacheKey;
import org.iceforge.imagecache.cache.CacheStats;
import org.iceforge.imagecache.cache.CachedArtifact;
import org.iceforge.imagecache.cache.CachedFile;
import org.iceforge.imagecache.cache.ProductImageCache;
import org.iceforge.imagecache.catalog.DownloadTaskSource;
import org.iceforge.imagecache.download.DownloadTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@RestController
@RequestMapping("/api/cache")
public class ImageCacheController {
    private static final Logger logger = LoggerFactory.getLogger(ImageCacheController.class);

    private final ProductImageCache cache;
    private final DownloadTaskSource taskSource;
    private final BatchStatusRegistry batches;

    public ImageCacheController(ProductImageCache cache,
                                DownloadTaskSource taskSource,
                                BatchStatusRegistry batches) {
        this.cache = Objects.requireNonNull(cache);
        this.taskSource = Objects.requireNonNull(taskSource);
        this.batches = Objects.requireNonNull(batches);
    }

    @PostMapping("/batches")
    public ResponseEntity<CacheApiModels.BatchStatusResponse> startBatch(@RequestBody CacheApiModels.BatchRequest req) {
        List<DownloadTask> tasks = new ArrayList<>();
        if (req.tasks() != null) {
            for (CacheApiModels.TaskSpec t : req.tasks()) {
                CacheKey key = CacheKey.of(t.entityId(), t.folder(), t.filename());
                tasks.add(new DownloadTask(key, t.sourceUrl(), t.expiresHint()));
            }
        }
        if (req.products() != null && !req.products().isEmpty()) {
            tasks.addAll(taskSource.pageTasks(req.products()));
        }
        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("batch has no tasks");
        }

        BatchStatusRegistry.Entry entry = batches.begin(tasks.size());
        if (!cache.startBatch(tasks, entry)) {
            entry.onError("batch could not be scheduled");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(entry.toResponse());
        }
        logger.info("Batch {} accepted: {} task(s)", entry.batchId(), tasks.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(entry.toResponse());
    }

    @GetMapping("/batches/current")
    public ResponseEntity<CacheApiModels.BatchStatusResponse> currentBatch() {
        return batches.current()
                .map(e -> ResponseEntity.ok(e.toResponse()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/batches/current")
    public ResponseEntity<CacheApiModels.BatchStatusResponse> stopBatch() {
        cache.stopBatch();
        return batches.cancelCurrent()
                .map(e -> ResponseEntity.status(HttpStatus.ACCEPTED).body(e.toResponse()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/entities/{entityId}/files/{folder}/{filename}")
    public ResponseEntity<byte[]> file(@PathVariable String entityId,
                                       @PathVariable String folder,
                                       @PathVariable String filename) {
        Optional<CachedArtifact> hit = cache.lookup(entityId, folder, filename);
        if (hit.isEmpty()) return ResponseEntity.notFound().build();

        MediaType type = MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(type).body(hit.get().data());
    }

    @GetMapping("/entities/{entityId}/meta")
    public ResponseEntity<JsonNode> meta(@PathVariable String entityId) {
        return cache.lookupCompanionMetadata(entityId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/entities/{entityId}")
    public ResponseEntity<Map<String, List<CacheApiModels.CachedFileResponse>>> entity(@PathVariable String entityId) {
        Map<String, List<CachedFile>> listing = cache.listCached(entityId);
        if (listing.isEmpty()) return ResponseEntity.notFound().build();

        Map<String, List<CacheApiModels.CachedFileResponse>> out = new LinkedHashMap<>();
        listing.forEach((folder, files) -> out.put(folder, files.stream()
                .map(f -> new CacheApiModels.CachedFileResponse(f.filename(), f.sizeBytes()))
                .toList()));
        return ResponseEntity.ok(out);
    }

    @PutMapping("/scope")
    public ResponseEntity<Void> setScope(@RequestBody CacheApiModels.ScopeRequest req) {
        cache.setPageScope(req.entityIds() == null ? Set.of() : req.entityIds());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/scope")
    public Set<String> scope() {
        return cache.pageScope();
    }

    @PostMapping("/evictions")
    public CacheApiModels.EvictionResponse evictOutsideScope() {
        return new CacheApiModels.EvictionResponse(cache.evictOutsideScope());
    }

    @DeleteMapping("/entities")
    public CacheApiModels.EvictionResponse evict(@RequestParam("ids") List<String> ids) {
        return new CacheApiModels.EvictionResponse(cache.evict(ids));
    }

    @DeleteMapping
    public ResponseEntity<Void> clearAll() {
        cache.clearAll();
        batches.cancelCurrent();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public CacheApiModels.StatsResponse stats() {
        CacheStats s = cache.stats();
        return new CacheApiModels.StatsResponse(
                cache.root().toString(),
                s.entityCount(),
                s.fileCount(),
                s.totalBytes(),
                s.memoryEntryCount(),
                cache.bytesUsed(),
                cache.hits(),
                cache.misses(),
                cache.hitRatio(),
                cache.isBatchRunning()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<CacheApiModels.ErrorResponse> badRequest(IllegalArgumentException e) {
        logger.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new CacheApiModels.ErrorResponse(e.getMessage()));
    }
}
