package org.iceforge.imagecache.aws.s3;

import org.iceforge.imagecache.aws.ImageCacheAwsProperties;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class S3ClientConfigTest {

    @Test
    void propertiesDefaults() {
        ImageCacheAwsProperties props = new ImageCacheAwsProperties(null, null);

        assertEquals("ap-northeast-2", props.region());
        assertFalse(props.s3().pathStyleAccess());
        assertEquals(Duration.ofSeconds(30), props.s3().apiCallTimeout());
        assertTrue(S3ClientConfig.endpoint(props).isEmpty());
    }

    @Test
    void blankEndpoint_isIgnored_andExplicitOneIsUsed() {
        assertTrue(S3ClientConfig.endpoint(new ImageCacheAwsProperties("us-east-1",
                new ImageCacheAwsProperties.S3Properties("  ", true, null))).isEmpty());

        ImageCacheAwsProperties minio = new ImageCacheAwsProperties("us-east-1",
                new ImageCacheAwsProperties.S3Properties("http://localhost:9000", true, Duration.ofSeconds(5)));
        assertEquals(URI.create("http://localhost:9000"), S3ClientConfig.endpoint(minio).orElseThrow());
    }

    @Test
    void clientBuildsWithoutContactingAws() {
        ImageCacheAwsProperties props = new ImageCacheAwsProperties("us-east-1",
                new ImageCacheAwsProperties.S3Properties("http://localhost:9000", true, Duration.ofSeconds(5)));
        S3ClientConfig config = new S3ClientConfig();

        try (S3Client client = config.s3Client(props, AnonymousCredentialsProvider.create())) {
            assertNotNull(client);
        }
        config.s3Presigner(props, AnonymousCredentialsProvider.create()).close();
    }
}
