package net.profilemedia.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import net.profilemedia.model.media.CompressionSettings;
import net.profilemedia.model.media.ForcedTypePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration for profile picture storage and compression.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "media.storage")
public class MediaStorageProperties {

    private static final long ONE_MIB = 1024L * 1024L;

    @NotBlank
    private String bucket = "avatars";
    @NotBlank
    private String folder = "profile-pictures";
    @Min(1)
    private int maxWidth = CompressionSettings.DEFAULT_MAX_WIDTH;
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private float quality = CompressionSettings.DEFAULT_QUALITY;
    @Min(0)
    private long compressionThresholdBytes = ONE_MIB;
    @Min(1)
    private long maxUploadBytes = 5L * ONE_MIB;
    @Min(0)
    private long cacheControlSeconds = 3600;
    @Min(1)
    private int listLimit = 100;
    @NotNull
    private ForcedTypePolicy forcedTypePolicy = ForcedTypePolicy.LENIENT;
    private String defaultAvatarUrl = "/images/default-avatar.png";

    /**
     * Bucket holding profile pictures.
     */
    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    /**
     * Top-level folder; every key lives under {@code {folder}/{ownerId}/}.
     */
    public String getFolder() {
        return folder;
    }

    public void setFolder(String folder) {
        this.folder = folder;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public float getQuality() {
        return quality;
    }

    public void setQuality(float quality) {
        this.quality = quality;
    }

    /**
     * Payloads at or below this size are never resampled.
     */
    public long getCompressionThresholdBytes() {
        return compressionThresholdBytes;
    }

    public void setCompressionThresholdBytes(long compressionThresholdBytes) {
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    /**
     * Uploads larger than this are rejected before processing.
     */
    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public void setMaxUploadBytes(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    public long getCacheControlSeconds() {
        return cacheControlSeconds;
    }

    public void setCacheControlSeconds(long cacheControlSeconds) {
        this.cacheControlSeconds = cacheControlSeconds;
    }

    /**
     * Page size used when listing an owner's objects for reconciliation.
     */
    public int getListLimit() {
        return listLimit;
    }

    public void setListLimit(int listLimit) {
        this.listLimit = listLimit;
    }

    public ForcedTypePolicy getForcedTypePolicy() {
        return forcedTypePolicy;
    }

    public void setForcedTypePolicy(ForcedTypePolicy forcedTypePolicy) {
        this.forcedTypePolicy = forcedTypePolicy;
    }

    /**
     * URL shown when an owner has no stored picture.
     */
    public String getDefaultAvatarUrl() {
        return defaultAvatarUrl;
    }

    public void setDefaultAvatarUrl(String defaultAvatarUrl) {
        this.defaultAvatarUrl = defaultAvatarUrl;
    }

    public CompressionSettings compressionSettings() {
        return new CompressionSettings(maxWidth, quality);
    }
}
