package net.profilemedia.model.media;

/**
 * A {@link SourceFile} paired with its authoritative content type.
 *
 * @param source the untouched upload
 * @param contentType corrected MIME type
 */
public record NormalizedFile(SourceFile source, String contentType) {

    public byte[] bytes() {
        return source.bytes();
    }

    public String fileName() {
        return source.fileName();
    }

    public long size() {
        return source.size();
    }

    /**
     * Whether the resolved type differs from what the caller claimed.
     */
    public boolean wasCorrected() {
        return !contentType.equals(source.contentType());
    }
}
