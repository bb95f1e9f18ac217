package org.iceforge.imagecache.aws.s3;

import org.iceforge.imagecache.aws.ImageCacheAwsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.util.Optional;

/**
 * S3 client for listing product assets and the presigner that mints their fetch URLs. Both
 * point at the same region and endpoint so presigned URLs resolve where the listing did.
 */
@Configuration
public class S3ClientConfig {

    @Bean
    public AwsCredentialsProvider imageCacheCredentials() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public S3Client s3Client(ImageCacheAwsProperties props, AwsCredentialsProvider imageCacheCredentials) {
        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(imageCacheCredentials)
                .region(Region.of(props.region()))
                .serviceConfiguration(serviceConfiguration(props))
                .overrideConfiguration(o -> o.apiCallTimeout(props.s3().apiCallTimeout()));
        endpoint(props).ifPresent(b::endpointOverride);
        return b.build();
    }

    @Bean
    public S3Presigner s3Presigner(ImageCacheAwsProperties props, AwsCredentialsProvider imageCacheCredentials) {
        S3Presigner.Builder b = S3Presigner.builder()
                .credentialsProvider(imageCacheCredentials)
                .region(Region.of(props.region()))
                .serviceConfiguration(serviceConfiguration(props));
        endpoint(props).ifPresent(b::endpointOverride);
        return b.build();
    }

    private static S3Configuration serviceConfiguration(ImageCacheAwsProperties props) {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(props.s3().pathStyleAccess())
                .build();
    }

    static Optional<URI> endpoint(ImageCacheAwsProperties props) {
        String endpoint = props.s3().endpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(URI.create(endpoint.trim()));
    }
}
