package org.iceforge.imagecache.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the local product image cache.
 * <p>
 * Defaults are safe for a single operator workstation.
 */
@ConfigurationProperties(prefix = "imagecache")
public class ImageCacheProperties {

    /** Cache root; artifacts live under {@code {rootDir}/{entityId}/{folder}/{filename}}. */
    private String rootDir = Path.of(System.getProperty("user.home"), ".cache", "ai_dataset_curation", "images").toString();

    /** How long a superseded or cleared batch may take to stop before it is interrupted. */
    private Duration stopWait = Duration.ofSeconds(3);

    /** Longest silence tolerated from a single fetch before it is failed. */
    private Duration fetchTimeout = Duration.ofSeconds(60);

    /** Validity of the presigned URLs minted for a batch. */
    private Duration presignTtl = Duration.ofHours(1);

    /** Bucket holding product assets under {@code {main}/{sub}/{productId}/...}. */
    private String bucket = "sw-fashion-image-data";

    /** Logical image folders fetched per product. */
    private List<String> folders = new ArrayList<>(List.of("detail", "segment", "summary", "text"));

    public String getRootDir() {
        return rootDir;
    }

    public void setRootDir(String rootDir) {
        this.rootDir = rootDir;
    }

    public Duration getStopWait() {
        return stopWait;
    }

    public void setStopWait(Duration stopWait) {
        this.stopWait = stopWait;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public Duration getPresignTtl() {
        return presignTtl;
    }

    public void setPresignTtl(Duration presignTtl) {
        this.presignTtl = presignTtl;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public List<String> getFolders() {
        return folders;
    }

    public void setFolders(List<String> folders) {
        this.folders = folders;
    }
}
