package net.profilemedia.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import net.profilemedia.model.media.ReconciliationResult;

/**
 * Response body for profile picture removal.
 *
 * @param success whether every matching object was removed
 * @param error soft-failure reason
 * @param removedCount number of objects removed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfilePictureDeleteResponse(boolean success, String error, int removedCount) {

    public static ProfilePictureDeleteResponse from(ReconciliationResult result) {
        return new ProfilePictureDeleteResponse(result.success(), result.error(), result.removedKeys().size());
    }
}
