package net.profilemedia.service.media;

import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.support.storage.ObjectStoreClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns whatever a profile stores as its avatar reference into a displayable URL.
 *
 * <p>Profiles hold either an absolute URL (new uploads) or a bare object key (older rows).
 * Blank references and keys the store cannot address resolve to the default avatar.</p>
 */
@Component
public class AvatarUrlResolver {

    private final ObjectStoreClient objectStoreClient;
    private final String bucket;
    private final String defaultAvatarUrl;

    public AvatarUrlResolver(ObjectStoreClient objectStoreClient, MediaStorageProperties properties) {
        this.objectStoreClient = objectStoreClient;
        this.bucket = properties.getBucket();
        this.defaultAvatarUrl = properties.getDefaultAvatarUrl();
    }

    public String resolve(String storedReference) {
        if (!StringUtils.hasText(storedReference)) {
            return defaultAvatarUrl;
        }
        String trimmed = storedReference.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return objectStoreClient.getPublicUrl(bucket, trimmed)
            .filter(StringUtils::hasText)
            .orElse(defaultAvatarUrl);
    }
}
