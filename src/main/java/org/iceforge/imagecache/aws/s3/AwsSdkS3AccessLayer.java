package org.iceforge.imagecache.aws.s3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class AwsSdkS3AccessLayer implements S3AccessLayer {
    private static final Logger logger = LoggerFactory.getLogger(AwsSdkS3AccessLayer.class);
    private final S3Client s3;
    private final S3Presigner presigner;

    public AwsSdkS3AccessLayer(S3Client s3, S3Presigner presigner) {
        this.s3 = s3;
        this.presigner = presigner;
    }

    @Override
    public Optional<S3Models.ObjectMetadata> head(S3Models.ObjectRef ref) {
        try {
            HeadObjectResponse r = s3.headObject(HeadObjectRequest.builder()
                    .bucket(ref.bucket())
                    .key(ref.key())
                    .build());

            return Optional.of(new S3Models.ObjectMetadata(
                    ref.bucket(),
                    ref.key(),
                    r.contentLength() == null ? 0L : r.contentLength(),
                    r.eTag(),
                    r.contentType(),
                    r.lastModified()
            ));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            // Some S3-compatible APIs throw generic 404 as S3Exception; treat 404 as not-found.
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            logger.error("S3 head failed for s3://{}/{}", ref.bucket(), ref.key(), e);
            throw new S3AccessException("S3 head failed: s3://" + ref.bucket() + "/" + ref.key(), e);
        }
    }

    @Override
    public boolean exists(S3Models.ObjectRef ref) {
        return head(ref).isPresent();
    }

    /**
     * Lists up to {@code maxKeys} objects under {@code prefix}, following continuation tokens.
     */
    @Override
    public List<S3Models.ListItem> list(String bucket, String prefix, int maxKeys) {
        int limit = Math.max(1, maxKeys);
        List<S3Models.ListItem> out = new ArrayList<>();
        String token = null;
        try {
            do {
                ListObjectsV2Response r = s3.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix == null ? "" : prefix)
                        .maxKeys(Math.min(1000, limit - out.size()))
                        .continuationToken(token)
                        .build());

                if (r.contents() != null) {
                    for (S3Object o : r.contents()) {
                        out.add(new S3Models.ListItem(o.key(), o.size() == null ? 0L : o.size(), o.eTag(), o.lastModified()));
                    }
                }
                token = Boolean.TRUE.equals(r.isTruncated()) ? r.nextContinuationToken() : null;
            } while (token != null && out.size() < limit);
            return out;
        } catch (S3Exception e) {
            logger.error("S3 list failed for bucket={} prefix={}", bucket, prefix, e);
            throw new S3AccessException("S3 list failed: bucket=" + bucket + " prefix=" + prefix, e);
        }
    }

    @Override
    public URL presignGet(S3Models.ObjectRef ref, Duration ttl) {
        try {
            GetObjectRequest getReq = GetObjectRequest.builder()
                    .bucket(ref.bucket())
                    .key(ref.key())
                    .build();

            PresignedGetObjectRequest presigned = presigner.presignGetObject(GetObjectPresignRequest.builder()
                    .signatureDuration(ttl == null ? Duration.ofHours(1) : ttl)
                    .getObjectRequest(getReq)
                    .build());
            return presigned.url();
        } catch (Exception e) {
            logger.error("S3 presignGet failed for s3://{}/{}", ref.bucket(), ref.key(), e);
            throw new S3AccessException("S3 presignGet failed: s3://" + ref.bucket() + "/" + ref.key(), e);
        }
    }
}
