/**
 * Configuration for the S3 client backing profile picture storage
 *
 * Features:
 * - Creates S3Client bean only when credentials are present
 * - Supports custom endpoint URL for MinIO, Spaces or Supabase's S3 gateway
 * - Optional path-style addressing for endpoints without virtual-host buckets
 * - Fails startup on incomplete credentials rather than at first upload
 */
package net.profilemedia.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}")
    private String accessKeyId;

    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}")
    private String secretAccessKey;

    @Value("${s3.server-url:${S3_SERVER_URL:}}")
    private String s3ServerUrl;

    @Value("${s3.region:${AWS_REGION:us-east-1}}")
    private String s3Region;

    @Value("${s3.path-style-access:false}")
    private boolean pathStyleAccess;

    /**
     * Creates the S3Client used by {@link net.profilemedia.support.storage.S3ObjectStoreClient}.
     *
     * @return configured S3Client instance
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        if (!hasText(accessKeyId) || !hasText(secretAccessKey)) {
            throw new IllegalStateException("S3 credentials are incomplete. Ensure s3.access-key-id and s3.secret-access-key are configured.");
        }

        try {
            var builder = S3Client.builder()
                    .region(Region.of(s3Region))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(pathStyleAccess)
                            .build());
            if (hasText(s3ServerUrl)) {
                builder.endpointOverride(URI.create(s3ServerUrl));
                logger.info("Configuring S3Client with custom endpoint {} and region {} (path-style: {})",
                        s3ServerUrl, s3Region, pathStyleAccess);
            } else {
                logger.info("Configuring S3Client for AWS-managed endpoint in region {}", s3Region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client bean due to configuration error", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
