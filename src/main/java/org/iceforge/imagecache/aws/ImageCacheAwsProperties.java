package org.iceforge.imagecache.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "imagecache.aws")
public record ImageCacheAwsProperties(
        String region,
        S3Properties s3
) {
    public ImageCacheAwsProperties {
        if (region == null || region.isBlank()) region = "ap-northeast-2";
        if (s3 == null) s3 = new S3Properties(null, false, null);
    }

    /**
     * @param apiCallTimeout upper bound for one S3 API call (list, head), retries included
     */
    public record S3Properties(
            String endpoint,
            boolean pathStyleAccess,
            Duration apiCallTimeout
    ) {
        public S3Properties {
            if (apiCallTimeout == null) apiCallTimeout = Duration.ofSeconds(30);
        }
    }
}
