package org.iceforge.imagecache.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.iceforge.imagecache.catalog.ProductRef;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public final class CacheApiModels {

    private CacheApiModels() {}

    public enum BatchState {
        RUNNING,
        DONE,
        CANCELLED,
        FAILED
    }

    /**
     * Either explicit {@code tasks} or {@code products} to resolve through the catalog.
     * When both are present they are concatenated, explicit tasks first.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BatchRequest(
            List<TaskSpec> tasks,
            List<ProductRef> products
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TaskSpec(
            String entityId,
            String folder,
            String filename,
            String sourceUrl,
            Instant expiresHint
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BatchStatusResponse(
            long batchId,
            BatchState state,
            int done,
            int failed,
            int total,
            Instant startedAt,
            Instant updatedAt,
            String message
    ) {}

    public record ScopeRequest(Set<String> entityIds) {}

    public record EvictionResponse(int deletedEntities) {}

    public record CachedFileResponse(String filename, long sizeBytes) {}

    public record StatsResponse(
            String root,
            int entityCount,
            long fileCount,
            long totalBytes,
            int memoryEntryCount,
            long memoryBytes,
            long hits,
            long misses,
            double hitRatio,
            boolean batchRunning
    ) {}

    public record ErrorResponse(String error) {}
}
