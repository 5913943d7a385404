package net.profilemedia.model.media;

import java.util.Objects;

/**
 * Terminal outcome of a profile picture upload: either a public URL or a readable reason.
 */
public sealed interface UploadResult permits UploadResult.Success, UploadResult.Failure {

    /**
     * Which stage turned the upload down; lets the HTTP layer choose a status code.
     */
    enum FailureKind {
        AUTHENTICATION,
        REJECTED,
        STORAGE,
        INTERNAL
    }

    static UploadResult success(String url, String storageKey) {
        return new Success(url, storageKey);
    }

    static UploadResult failure(String reason, FailureKind kind) {
        return new Failure(reason, kind);
    }

    boolean isSuccess();

    /**
     * Stored object is addressable at {@code url}.
     *
     * @param url public URL resolved for {@code storageKey}
     * @param storageKey key the bytes were written under
     */
    record Success(String url, String storageKey) implements UploadResult {
        public Success {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(storageKey, "storageKey");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Upload did not produce an addressable object.
     *
     * @param reason human-readable message
     * @param kind stage that failed
     */
    record Failure(String reason, FailureKind kind) implements UploadResult {
        public Failure {
            reason = reason == null || reason.isBlank() ? "Upload failed" : reason;
            kind = kind == null ? FailureKind.INTERNAL : kind;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
