package net.profilemedia.support.storage;

import org.springframework.lang.Nullable;

/**
 * Per-write options.
 *
 * @param upsert replace an existing object at the same key instead of failing
 * @param cacheControl {@code Cache-Control} header stored with the object, optional
 */
public record UploadOptions(boolean upsert, @Nullable String cacheControl) {

    public static UploadOptions upsert(long cacheControlSeconds) {
        return new UploadOptions(true, cacheControlSeconds > 0 ? "max-age=" + cacheControlSeconds : null);
    }
}
