package net.profilemedia.model.media;

/**
 * Downscale and re-encode parameters.
 *
 * @param maxWidth bounding box edge in pixels, applied to both dimensions
 * @param quality JPEG quality in {@code (0, 1]}
 */
public record CompressionSettings(int maxWidth, float quality) {

    public static final int DEFAULT_MAX_WIDTH = 400;
    public static final float DEFAULT_QUALITY = 0.8f;

    public CompressionSettings {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
        if (quality <= 0f || quality > 1f) {
            throw new IllegalArgumentException("quality must be within (0, 1]: " + quality);
        }
    }

    public static CompressionSettings defaults() {
        return new CompressionSettings(DEFAULT_MAX_WIDTH, DEFAULT_QUALITY);
    }
}
