package net.profilemedia.service.media;

import java.time.Clock;
import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.StorageKey;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Single source of truth for profile picture object keys.
 *
 * Key format: {folder}/{ownerId}/{ownerId}_{epochMillis}.{ext}
 * Example: profile-pictures/3f2c9a/3f2c9a_1718000000000.png
 *
 * Two keys for one owner collide only within the same clock tick and extension.
 */
@Component
public class StorageKeyBuilder {

    private static final String DEFAULT_EXTENSION = "jpg";

    private final String folder;
    private final Clock clock;

    @Autowired
    public StorageKeyBuilder(MediaStorageProperties properties, Clock clock) {
        this(properties.getFolder(), clock);
    }

    StorageKeyBuilder(String folder, Clock clock) {
        this.folder = trimSlashes(folder);
        this.clock = clock;
    }

    /**
     * Generates the key for a new upload.
     *
     * @param ownerId authenticated owner, must be non-blank and free of {@code /}
     * @param originalFileName client-supplied name; its extension is kept only when it is a known
     *                         raster extension, otherwise {@code jpg} is used
     * @return key under {@code {folder}/{ownerId}/}
     * @throws IllegalArgumentException if ownerId is invalid
     */
    public StorageKey build(String ownerId, String originalFileName) {
        validateOwnerId(ownerId);
        String extension = MimeTypeResolver.rasterExtensionOf(originalFileName);
        if (extension == null) {
            extension = DEFAULT_EXTENSION;
        }
        String fileName = ownerId + "_" + clock.millis() + "." + extension;
        return new StorageKey(folder, ownerId, fileName);
    }

    /**
     * Prefix covering every object of {@code ownerId}, with trailing slash.
     */
    public String ownerPrefix(String ownerId) {
        validateOwnerId(ownerId);
        return folder + "/" + ownerId + "/";
    }

    /**
     * Whether {@code key} sits under the owner's segment.
     */
    public boolean isOwnedBy(String key, String ownerId) {
        return key != null && StringUtils.hasText(ownerId) && key.startsWith(folder + "/" + ownerId + "/");
    }

    private static void validateOwnerId(String ownerId) {
        if (!StringUtils.hasText(ownerId)) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
        if (ownerId.contains("/")) {
            throw new IllegalArgumentException("Owner id must not contain '/': " + ownerId);
        }
    }

    private static String trimSlashes(String value) {
        String trimmed = value == null ? "" : value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Storage folder must not be blank");
        }
        return trimmed;
    }
}
