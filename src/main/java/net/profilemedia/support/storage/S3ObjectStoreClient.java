package net.profilemedia.support.storage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import net.profilemedia.exception.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.web.util.UriUtils;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Infrastructure adapter implementing {@link ObjectStoreClient} on the AWS SDK v2.
 *
 * <p>Works against AWS S3 and S3-compatible endpoints (MinIO, DigitalOcean Spaces, Supabase
 * Storage's S3 gateway). A {@code null} client puts the adapter in disabled mode: writes report
 * {@link StoreOperationResult#disabled()} and listing throws.</p>
 */
public final class S3ObjectStoreClient implements ObjectStoreClient {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStoreClient.class);

    private final S3Client s3Client;
    private final String publicCdnUrl;
    private final String serverUrl;

    public S3ObjectStoreClient(@Nullable S3Client s3Client,
                               @Nullable String publicCdnUrl,
                               @Nullable String serverUrl) {
        this.s3Client = s3Client;
        this.publicCdnUrl = publicCdnUrl;
        this.serverUrl = serverUrl;
        if (s3Client == null) {
            logger.warn("S3 object store client initialized without an S3 client. Uploads will fail until S3 is configured.");
        }
    }

    @Override
    public StoreOperationResult upload(String bucket, String key, byte[] bytes, String contentType, UploadOptions options) {
        if (s3Client == null) {
            logger.warn("Skipping upload of {} to bucket {}: S3 is not configured", key, bucket);
            return StoreOperationResult.disabled();
        }
        try {
            PutObjectRequest.Builder requestBuilder = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) bytes.length);
            if (options.cacheControl() != null) {
                requestBuilder.cacheControl(options.cacheControl());
            }
            if (!options.upsert()) {
                // Conditional write: S3 answers 412 when the key already exists
                requestBuilder.ifNoneMatch("*");
            }
            s3Client.putObject(requestBuilder.build(), RequestBody.fromBytes(bytes));
            logger.info("Successfully uploaded {} ({} bytes, {}) to bucket {}", key, bytes.length, contentType, bucket);
            return StoreOperationResult.success();
        } catch (S3Exception exception) {
            String message = resolveS3ErrorMessage(exception);
            logger.error("S3 error uploading {} to bucket {}: {}", key, bucket, message, exception);
            return StoreOperationResult.serviceError(message);
        } catch (SdkClientException | IllegalArgumentException exception) {
            logger.error("Unexpected error uploading {} to bucket {}: {}", key, bucket, exception.getMessage(), exception);
            return StoreOperationResult.serviceError(exception.getMessage());
        }
    }

    @Override
    public Optional<String> getPublicUrl(String bucket, String key) {
        if (!hasText(bucket) || !hasText(key)) {
            return Optional.empty();
        }
        String normalizedKey = encodeKeyPath(normalizePathSegment(key));

        if (hasText(publicCdnUrl)) {
            return Optional.of(joinPath(normalizeBaseUrl(publicCdnUrl), normalizedKey));
        }
        if (hasText(serverUrl)) {
            return Optional.of(joinPath(joinPath(normalizeBaseUrl(serverUrl), bucket), normalizedKey));
        }
        return Optional.of("https://" + bucket + ".s3.amazonaws.com/" + normalizedKey);
    }

    @Override
    public List<StoredObject> list(String bucket, String prefix, int limit) {
        if (s3Client == null) {
            throw new ObjectStoreException("S3 client is not configured. Cannot list objects.", bucket);
        }
        logger.debug("Listing up to {} objects in bucket {} with prefix '{}'", limit, bucket, prefix);
        try {
            ListObjectsV2Request.Builder requestBuilder = ListObjectsV2Request.builder()
                .bucket(bucket)
                .maxKeys(limit);
            if (hasText(prefix)) {
                requestBuilder.prefix(prefix);
            }
            ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
            if (Boolean.TRUE.equals(response.isTruncated())) {
                logger.info("Listing of bucket {} prefix '{}' truncated at {} objects", bucket, prefix, limit);
            }
            return response.contents().stream()
                .map(object -> new StoredObject(object.key(), object.size()))
                .toList();
        } catch (S3Exception exception) {
            throw new ObjectStoreException(
                "S3 error listing objects in bucket " + bucket + ": " + resolveS3ErrorMessage(exception),
                bucket,
                exception
            );
        } catch (SdkClientException | IllegalArgumentException exception) {
            throw new ObjectStoreException(
                "Unexpected error listing objects in bucket " + bucket + ": " + exception.getMessage(),
                bucket,
                exception
            );
        }
    }

    @Override
    public StoreOperationResult remove(String bucket, List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return StoreOperationResult.success();
        }
        if (s3Client == null) {
            return StoreOperationResult.disabled();
        }
        try {
            List<ObjectIdentifier> identifiers = keys.stream()
                .map(key -> ObjectIdentifier.builder().key(key).build())
                .toList();
            DeleteObjectsRequest request = DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(identifiers).quiet(true).build())
                .build();
            DeleteObjectsResponse response = s3Client.deleteObjects(request);
            if (response.hasErrors() && !response.errors().isEmpty()) {
                S3Error first = response.errors().get(0);
                logger.error("Bulk delete in bucket {} reported {} error(s); first: {} {}",
                    bucket, response.errors().size(), first.key(), first.message());
                return StoreOperationResult.serviceError(
                    "Failed to delete " + first.key() + ": " + Objects.requireNonNullElse(first.message(), first.code()));
            }
            logger.info("Deleted {} object(s) from bucket {}", keys.size(), bucket);
            return StoreOperationResult.success();
        } catch (S3Exception exception) {
            String message = resolveS3ErrorMessage(exception);
            logger.error("S3 error deleting {} object(s) from bucket {}: {}", keys.size(), bucket, message, exception);
            return StoreOperationResult.serviceError(message);
        } catch (SdkClientException | IllegalArgumentException exception) {
            logger.error("Unexpected error deleting {} object(s) from bucket {}: {}",
                keys.size(), bucket, exception.getMessage(), exception);
            return StoreOperationResult.serviceError(exception.getMessage());
        }
    }

    public boolean isEnabled() {
        return s3Client != null;
    }

    private static String normalizeBaseUrl(String value) {
        String trimmed = Objects.requireNonNullElse(value, "").trim();
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String normalizePathSegment(String value) {
        String trimmed = Objects.requireNonNullElse(value, "").trim();
        if (trimmed.startsWith("/")) {
            return trimmed.substring(1);
        }
        return trimmed;
    }

    /**
     * Percent-encodes each {@code /}-separated segment of the key, keeping the separators.
     */
    private static String encodeKeyPath(String key) {
        return Arrays.stream(key.split("/", -1))
            .map(segment -> UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8))
            .collect(Collectors.joining("/"));
    }

    private static String joinPath(String base, String suffix) {
        if (!hasText(base)) {
            return suffix;
        }
        if (base.endsWith("/")) {
            return base + suffix;
        }
        return base + "/" + suffix;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
