package net.profilemedia.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Reports whether the profile picture bucket is reachable.
 */
@Component("s3HealthIndicator")
public class S3HealthIndicator implements ReactiveHealthIndicator {

    private static final Duration S3_TIMEOUT = Duration.ofSeconds(5);

    private final S3Client s3Client;
    private final String bucketName;

    @Autowired
    public S3HealthIndicator(ObjectProvider<S3Client> s3Client, MediaStorageProperties properties) {
        this(s3Client.getIfAvailable(), properties.getBucket());
    }

    S3HealthIndicator(S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public Mono<Health> health() {
        if (s3Client == null) {
            return Mono.just(Health.down()
                    .withDetail("s3_status", "misconfigured_or_disabled")
                    .withDetail("detail", "S3Client bean is not available, check S3 credentials.")
                    .build());
        }

        if (bucketName == null || bucketName.isEmpty()) {
            return Mono.just(Health.down()
                    .withDetail("s3_status", "misconfigured")
                    .withDetail("detail", "Profile picture bucket is not configured.")
                    .build());
        }

        HeadBucketRequest headBucketRequest = HeadBucketRequest.builder()
                .bucket(bucketName)
                .build();

        return Mono.fromCallable(() -> {
                    s3Client.headBucket(headBucketRequest);
                    return Health.up()
                            .withDetail("s3_status", "available")
                            .withDetail("bucket", bucketName)
                            .build();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(S3_TIMEOUT)
                .onErrorResume(S3Exception.class, ex -> {
                    var details = ex.awsErrorDetails();
                    String error = (details != null)
                            ? details.errorCode() + ": " + details.errorMessage()
                            : ex.getMessage();
                    return Mono.just(Health.down()
                            .withDetail("s3_status", "s3_error")
                            .withDetail("bucket", bucketName)
                            .withDetail("error", error)
                            .build());
                })
                .onErrorResume(TimeoutException.class, ex -> Mono.just(Health.down()
                        .withDetail("s3_status", "timeout")
                        .withDetail("bucket", bucketName)
                        .build()))
                .onErrorResume(SdkClientException.class, ex -> Mono.just(Health.down()
                        .withDetail("s3_status", "sdk_client_error")
                        .withDetail("bucket", bucketName)
                        .withDetail("message", String.valueOf(ex.getMessage()))
                        .build()));
    }
}
