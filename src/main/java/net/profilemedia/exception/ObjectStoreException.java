package net.profilemedia.exception;

/**
 * Object store call failed (service error, permissions, transport, or missing configuration).
 * Callers of the upload path never see this; it is converted to a result value at the boundary.
 */
public class ObjectStoreException extends RuntimeException {

    private final String bucket;

    public ObjectStoreException(String message, String bucket) {
        super(message);
        this.bucket = bucket;
    }

    public ObjectStoreException(String message, String bucket, Throwable cause) {
        super(message, cause);
        this.bucket = bucket;
    }

    public String getBucket() {
        return bucket;
    }
}
