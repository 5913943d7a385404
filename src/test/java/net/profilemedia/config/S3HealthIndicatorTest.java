package net.profilemedia.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

class S3HealthIndicatorTest {

    @Test
    void shouldReportDownWhenClientMissing() {
        S3HealthIndicator indicator = new S3HealthIndicator(null, "avatars");

        StepVerifier.create(indicator.health())
            .assertNext(health -> {
                assertEquals(Status.DOWN, health.getStatus());
                assertEquals("misconfigured_or_disabled", health.getDetails().get("s3_status"));
            })
            .verifyComplete();
    }

    @Test
    void shouldReportDownWhenBucketMissing() {
        S3HealthIndicator indicator = new S3HealthIndicator(mock(S3Client.class), "");

        StepVerifier.create(indicator.health())
            .assertNext(health -> assertEquals(Status.DOWN, health.getStatus()))
            .verifyComplete();
    }

    @Test
    void shouldReportDownWhenS3ThrowsServiceError() {
        S3Client mockClient = mock(S3Client.class);
        S3Exception s3Exception = (S3Exception) S3Exception.builder()
            .awsErrorDetails(AwsErrorDetails.builder()
                .errorCode("NoSuchBucket")
                .errorMessage("Bucket not found")
                .build())
            .message("Bucket not found")
            .build();
        when(mockClient.headBucket(any(HeadBucketRequest.class))).thenThrow(s3Exception);

        S3HealthIndicator indicator = new S3HealthIndicator(mockClient, "missing-bucket");

        StepVerifier.create(indicator.health())
            .assertNext(health -> {
                assertEquals(Status.DOWN, health.getStatus());
                assertEquals("NoSuchBucket: Bucket not found", health.getDetails().get("error"));
            })
            .verifyComplete();
    }

    @Test
    void shouldReportDownWhenSdkClientFails() {
        S3Client mockClient = mock(S3Client.class);
        when(mockClient.headBucket(any(HeadBucketRequest.class)))
            .thenThrow(SdkClientException.create("Unable to connect"));

        S3HealthIndicator indicator = new S3HealthIndicator(mockClient, "avatars");

        StepVerifier.create(indicator.health())
            .assertNext(health -> assertEquals("sdk_client_error", health.getDetails().get("s3_status")))
            .verifyComplete();
    }

    @Test
    void shouldReportUpWhenBucketIsReachable() {
        S3Client mockClient = mock(S3Client.class);
        when(mockClient.headBucket(any(HeadBucketRequest.class)))
            .thenReturn(HeadBucketResponse.builder().build());

        S3HealthIndicator indicator = new S3HealthIndicator(mockClient, "avatars");

        StepVerifier.create(indicator.health())
            .assertNext(health -> {
                assertEquals(Status.UP, health.getStatus());
                assertEquals("avatars", health.getDetails().get("bucket"));
            })
            .verifyComplete();
    }
}
