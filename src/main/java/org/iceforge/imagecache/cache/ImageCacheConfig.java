package org.iceforge.imagecache.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.imagecache.download.ArtifactFetcher;
import org.iceforge.imagecache.download.BatchDownloader;
import org.iceforge.imagecache.download.WebClientArtifactFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ImageCacheConfig {

    @Bean
    public DiskStore imageDiskStore(ImageCacheProperties props) {
        return new DiskStore(Path.of(props.getRootDir()));
    }

    /**
     * One live batch at a time; a new thread is only needed when a superseded batch ignores
     * its interrupt.
     */
    @Bean
    public ExecutorService imageBatchExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "image-batch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ArtifactFetcher artifactFetcher(WebClient.Builder webClientBuilder, ImageCacheProperties props) {
        return new WebClientArtifactFetcher(webClientBuilder, props.getFetchTimeout());
    }

    @Bean
    public BatchDownloader batchDownloader(DiskStore imageDiskStore,
                                           ArtifactFetcher artifactFetcher,
                                           ExecutorService imageBatchExecutor,
                                           ImageCacheProperties props) {
        return new BatchDownloader(imageDiskStore, artifactFetcher, imageBatchExecutor, props.getStopWait());
    }

    @Bean
    public ProductImageCache productImageCache(DiskStore imageDiskStore,
                                               BatchDownloader batchDownloader,
                                               ObjectMapper objectMapper) {
        return new ProductImageCache(imageDiskStore, batchDownloader, objectMapper);
    }
}
