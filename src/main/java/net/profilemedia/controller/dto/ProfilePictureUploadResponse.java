package net.profilemedia.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import net.profilemedia.model.media.UploadResult;

/**
 * Response body for profile picture uploads.
 *
 * @param success whether the picture is stored and addressable
 * @param url public URL on success
 * @param storageKey object key on success
 * @param error reason on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfilePictureUploadResponse(boolean success, String url, String storageKey, String error) {

    public static ProfilePictureUploadResponse from(UploadResult result) {
        if (result instanceof UploadResult.Success success) {
            return new ProfilePictureUploadResponse(true, success.url(), success.storageKey(), null);
        }
        UploadResult.Failure failure = (UploadResult.Failure) result;
        return new ProfilePictureUploadResponse(false, null, null, failure.reason());
    }

    public static ProfilePictureUploadResponse error(String message) {
        return new ProfilePictureUploadResponse(false, null, null, message);
    }
}
