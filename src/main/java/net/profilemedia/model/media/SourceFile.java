package net.profilemedia.model.media;

import java.util.Arrays;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Raw upload payload exactly as the caller supplied it.
 *
 * <p>The claimed file name and content type are untrusted metadata; {@code size} is always the
 * byte length of {@code bytes}.</p>
 *
 * @param bytes raw payload
 * @param fileName claimed file name, may be {@code null}
 * @param contentType claimed MIME type, may be {@code null}
 * @param size byte length of the payload
 */
public record SourceFile(byte[] bytes,
                         @Nullable String fileName,
                         @Nullable String contentType,
                         long size) {

    public SourceFile {
        bytes = bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
        size = bytes.length;
    }

    /**
     * Creates a source file, deriving the size from the payload.
     */
    public static SourceFile of(byte[] bytes, @Nullable String fileName, @Nullable String contentType) {
        return new SourceFile(bytes, fileName, contentType, bytes == null ? 0 : bytes.length);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SourceFile that)) {
            return false;
        }
        return Arrays.equals(bytes, that.bytes)
            && Objects.equals(fileName, that.fileName)
            && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(fileName, contentType) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "SourceFile{fileName=" + fileName + ", contentType=" + contentType + ", size=" + size + '}';
    }
}
