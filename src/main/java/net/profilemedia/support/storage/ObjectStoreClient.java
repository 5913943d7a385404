package net.profilemedia.support.storage;

import java.util.List;
import java.util.Optional;
import net.profilemedia.exception.ObjectStoreException;

/**
 * Bucketed byte storage with public URL resolution.
 *
 * <p>Write-side calls report failures as {@link StoreOperationResult} values; only listing throws,
 * since a partial listing has no meaningful value representation.</p>
 */
public interface ObjectStoreClient {

    /**
     * Stores {@code bytes} under {@code key}.
     */
    StoreOperationResult upload(String bucket, String key, byte[] bytes, String contentType, UploadOptions options);

    /**
     * Public URL of {@code key}, empty when none can be produced.
     */
    Optional<String> getPublicUrl(String bucket, String key);

    /**
     * Lists at most {@code limit} objects whose key starts with {@code prefix}.
     *
     * @throws ObjectStoreException when the store cannot be listed
     */
    List<StoredObject> list(String bucket, String prefix, int limit);

    /**
     * Removes all of {@code keys} in one request.
     */
    StoreOperationResult remove(String bucket, List<String> keys);
}
