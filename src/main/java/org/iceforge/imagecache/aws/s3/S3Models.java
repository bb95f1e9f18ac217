package org.iceforge.imagecache.aws.s3;

import java.time.Instant;

public final class S3Models {

    private S3Models() {}

    public record ObjectRef(String bucket, String key) {}

    public record ObjectMetadata(
            String bucket,
            String key,
            long contentLength,
            String eTag,
            String contentType,
            Instant lastModified
    ) {}

    public record ListItem(
            String key,
            long size,
            String eTag,
            Instant lastModified
    ) {}
}
