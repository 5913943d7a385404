package net.profilemedia.model.media;

import java.util.Arrays;
import java.util.Objects;

/**
 * Payload ready for storage after type correction and optional resampling.
 *
 * @param bytes final payload
 * @param fileName original file name, kept for key derivation
 * @param contentType final MIME type, always a supported raster type
 * @param size byte length of {@code bytes}
 * @param width decoded width in pixels, {@code 0} when the image was not decoded
 * @param height decoded height in pixels, {@code 0} when the image was not decoded
 * @param resampled whether the payload was downscaled and re-encoded
 */
public record ProcessedFile(byte[] bytes,
                            String fileName,
                            String contentType,
                            long size,
                            int width,
                            int height,
                            boolean resampled) {

    public ProcessedFile {
        Objects.requireNonNull(contentType, "contentType");
        bytes = bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
        size = bytes.length;
    }

    /**
     * Wraps the normalized bytes untouched under the given content type.
     */
    public static ProcessedFile passThrough(NormalizedFile file, String contentType) {
        return new ProcessedFile(file.bytes(), file.fileName(), contentType, file.size(), 0, 0, false);
    }

    /**
     * Builds a resampled JPEG result.
     */
    public static ProcessedFile resampled(byte[] bytes, String fileName, int width, int height) {
        return new ProcessedFile(bytes, fileName, "image/jpeg", bytes.length, width, height, true);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ProcessedFile that)) {
            return false;
        }
        return width == that.width
            && height == that.height
            && resampled == that.resampled
            && Arrays.equals(bytes, that.bytes)
            && Objects.equals(fileName, that.fileName)
            && contentType.equals(that.contentType);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(fileName, contentType, width, height, resampled) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ProcessedFile{fileName=" + fileName + ", contentType=" + contentType + ", size=" + size
            + ", dimensions=" + width + "x" + height + ", resampled=" + resampled + '}';
    }
}
