package net.profilemedia.model.media;

/**
 * How to treat content whose resolved type is not a supported raster image.
 */
public enum ForcedTypePolicy {

    /**
     * Relabel the bytes as {@code image/jpeg} without inspecting them. The stored object may not
     * be a valid image.
     */
    LENIENT,

    /**
     * Accept the forced type only when the bytes decode as an image.
     */
    REQUIRE_DECODABLE
}
