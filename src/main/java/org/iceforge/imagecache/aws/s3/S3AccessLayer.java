package org.iceforge.imagecache.aws.s3;

import java.net.URL;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read-side view of the blob store holding product assets.
 */
public interface S3AccessLayer {

    // Metadata / existence
    Optional<S3Models.ObjectMetadata> head(S3Models.ObjectRef ref);
    boolean exists(S3Models.ObjectRef ref);

    // List
    List<S3Models.ListItem> list(String bucket, String prefix, int maxKeys);

    // Presigned URLs
    URL presignGet(S3Models.ObjectRef ref, Duration ttl);
}
