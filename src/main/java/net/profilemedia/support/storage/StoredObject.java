package net.profilemedia.support.storage;

/**
 * Listing entry for a stored object.
 *
 * @param key full object key
 * @param sizeBytes object size, {@code null} when the store did not report one
 */
public record StoredObject(String key, Long sizeBytes) {

    /**
     * Last path segment of the key.
     */
    public String name() {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }
}
