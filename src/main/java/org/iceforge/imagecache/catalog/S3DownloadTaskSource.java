package org.iceforge.imagecache.catalog;

import org.iceforge.imagecache.aws.s3.S3AccessException;
import org.iceforge.imagecache.aws.s3.S3AccessLayer;
import org.iceforge.imagecache.aws.s3.S3Models;
import org.iceforge.imagecache.cache.CacheKey;
import org.iceforge.imagecache.cache.ImageCacheProperties;
import org.iceforge.imagecache.download.DownloadTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URL;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lists {@code {main}/{sub}/{productId}/{folder}/} for every configured folder and presigns a
 * GET URL per object.
 */
@Service
public class S3DownloadTaskSource implements DownloadTaskSource {
    private static final Logger logger = LoggerFactory.getLogger(S3DownloadTaskSource.class);

    private static final int MAX_KEYS_PER_FOLDER = 1000;

    private final S3AccessLayer s3;
    private final ImageCacheProperties props;
    private final Clock clock;

    @Autowired
    public S3DownloadTaskSource(S3AccessLayer s3, ImageCacheProperties props) {
        this(s3, props, Clock.systemUTC());
    }

    S3DownloadTaskSource(S3AccessLayer s3, ImageCacheProperties props, Clock clock) {
        this.s3 = Objects.requireNonNull(s3);
        this.props = Objects.requireNonNull(props);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public List<DownloadTask> tasksFor(ProductRef product) {
        List<DownloadTask> out = new ArrayList<>();
        for (String folder : props.getFolders()) {
            String prefix = product.prefix() + folder + "/";
            List<S3Models.ListItem> items;
            try {
                items = s3.list(props.getBucket(), prefix, MAX_KEYS_PER_FOLDER);
            } catch (S3AccessException e) {
                logger.warn("Skipping folder {} of product {}: {}", folder, product.productId(), e.getMessage());
                continue;
            }
            for (S3Models.ListItem item : items) {
                String rest = item.key().substring(prefix.length());
                // Direct children only; folder markers and nested keys have no place in the layout.
                if (rest.isEmpty() || rest.contains("/")) {
                    continue;
                }
                CacheKey cacheKey;
                try {
                    cacheKey = CacheKey.of(product.productId(), folder, rest);
                } catch (IllegalArgumentException e) {
                    logger.warn("Skipping object with unusable name {}: {}", item.key(), e.getMessage());
                    continue;
                }
                presign(cacheKey, item.key()).ifPresent(out::add);
            }
        }
        logger.info("Collected {} image task(s) for product {}", out.size(), product.productId());
        return out;
    }

    @Override
    public Optional<DownloadTask> companionTaskFor(ProductRef product) {
        String key = product.prefix() + CacheKey.SIDECAR_FILENAME;
        try {
            if (!s3.exists(new S3Models.ObjectRef(props.getBucket(), key))) {
                logger.warn("No {} for product {}", CacheKey.SIDECAR_FILENAME, product.productId());
                return Optional.empty();
            }
        } catch (S3AccessException e) {
            logger.warn("Could not check {} for product {}: {}", CacheKey.SIDECAR_FILENAME, product.productId(), e.getMessage());
            return Optional.empty();
        }
        return presign(CacheKey.sidecar(product.productId()), key);
    }

    private Optional<DownloadTask> presign(CacheKey cacheKey, String objectKey) {
        Duration ttl = props.getPresignTtl();
        try {
            Instant expires = clock.instant().plus(ttl);
            URL url = s3.presignGet(new S3Models.ObjectRef(props.getBucket(), objectKey), ttl);
            return Optional.of(new DownloadTask(cacheKey, url.toString(), expires));
        } catch (S3AccessException e) {
            logger.warn("Could not presign {}: {}", objectKey, e.getMessage());
            return Optional.empty();
        }
    }
}
