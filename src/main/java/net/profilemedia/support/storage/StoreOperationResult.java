/**
 * Represents the result of a write-side object store call
 * - Success carries no payload
 * - Failure carries the store's message verbatim so callers can surface it
 * - Disabled distinguishes a missing S3 configuration from a service error
 */
package net.profilemedia.support.storage;

import java.util.Optional;

public final class StoreOperationResult {

    public enum Status {
        SUCCESS,
        SERVICE_ERROR,
        DISABLED
    }

    private static final StoreOperationResult SUCCESS = new StoreOperationResult(Status.SUCCESS, null);

    private final Status status;
    private final String errorMessage;

    private StoreOperationResult(Status status, String errorMessage) {
        if (status != Status.SUCCESS && errorMessage == null) {
            throw new IllegalArgumentException(status + " result requires non-null errorMessage");
        }
        this.status = status;
        this.errorMessage = errorMessage;
    }

    public static StoreOperationResult success() {
        return SUCCESS;
    }

    /**
     * Create a service error result
     *
     * @param errorMessage message reported by the store
     * @return a failed result carrying the message
     */
    public static StoreOperationResult serviceError(String errorMessage) {
        return new StoreOperationResult(Status.SERVICE_ERROR, errorMessage == null ? "Object store error" : errorMessage);
    }

    public static StoreOperationResult disabled() {
        return new StoreOperationResult(Status.DISABLED, "Object storage is not configured");
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Status getStatus() {
        return status;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "StoreOperationResult{status=" + status + (errorMessage != null ? ", error='" + errorMessage + "'" : "") + '}';
    }
}
