package net.profilemedia.model.media;

/**
 * Object key of a stored profile picture.
 *
 * <p>Shape: {@code {folder}/{ownerId}/{fileName}}. The owner segment is a path component because
 * the bucket policy only authorizes writes under {@code {folder}/{ownerId}/}.</p>
 *
 * @param folder configured namespace folder
 * @param ownerId authenticated owner
 * @param fileName generated file name, {@code {ownerId}_{millis}.{ext}}
 */
public record StorageKey(String folder, String ownerId, String fileName) {

    public String value() {
        return folder + "/" + ownerId + "/" + fileName;
    }

    @Override
    public String toString() {
        return value();
    }
}
