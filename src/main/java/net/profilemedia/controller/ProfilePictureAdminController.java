package net.profilemedia.controller;

import net.profilemedia.controller.dto.ProfilePictureDeleteResponse;
import net.profilemedia.model.media.ReconciliationResult;
import net.profilemedia.service.media.ProfilePictureRetentionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoint for pruning any owner's stored pictures. Secured to ADMIN by
 * {@link net.profilemedia.config.SecurityConfig}.
 */
@RestController
@RequestMapping("/admin/profile-pictures")
public class ProfilePictureAdminController {

    private static final Logger log = LoggerFactory.getLogger(ProfilePictureAdminController.class);

    private final ProfilePictureRetentionService retentionService;

    public ProfilePictureAdminController(ProfilePictureRetentionService retentionService) {
        this.retentionService = retentionService;
    }

    /**
     * Removes the owner's pictures, optionally keeping one key.
     *
     * @param ownerId owner to reconcile
     * @param keep key to leave in place
     * @return reconciliation summary
     */
    @DeleteMapping("/{ownerId}")
    public ResponseEntity<ProfilePictureDeleteResponse> reconcile(@PathVariable String ownerId,
                                                                  @RequestParam(required = false) String keep) {
        log.info("Admin reconciliation requested for owner {} (keep={})", ownerId, keep);
        ReconciliationResult result = retentionService.reconcile(ownerId, keep);
        return ResponseEntity.ok(ProfilePictureDeleteResponse.from(result));
    }
}
