package net.profilemedia.config;

import java.time.Clock;
import net.profilemedia.support.storage.ObjectStoreClient;
import net.profilemedia.support.storage.S3ObjectStoreClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Wires the object store adapter and the clock used for key generation.
 */
@Configuration
public class MediaStorageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Object store adapter; runs disabled when no {@link S3Client} bean exists.
     */
    @Bean
    public ObjectStoreClient objectStoreClient(ObjectProvider<S3Client> s3Client,
                                               @Value("${s3.cdn-url:${S3_CDN_URL:}}") String publicCdnUrl,
                                               @Value("${s3.server-url:${S3_SERVER_URL:}}") String serverUrl) {
        return new S3ObjectStoreClient(s3Client.getIfAvailable(), publicCdnUrl, serverUrl);
    }
}
