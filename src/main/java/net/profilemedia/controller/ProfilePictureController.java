package net.profilemedia.controller;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import net.profilemedia.auth.AuthenticatedUser;
import net.profilemedia.auth.AuthenticationGateway;
import net.profilemedia.controller.dto.ProfilePictureDeleteResponse;
import net.profilemedia.controller.dto.ProfilePictureUploadResponse;
import net.profilemedia.model.media.ReconciliationResult;
import net.profilemedia.model.media.SourceFile;
import net.profilemedia.model.media.UploadResult;
import net.profilemedia.service.media.AvatarUrlResolver;
import net.profilemedia.service.media.ProfilePictureRetentionService;
import net.profilemedia.service.media.ProfilePictureUploadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Self-service profile picture endpoints for the authenticated user.
 */
@RestController
@RequestMapping("/api/profile-picture")
public class ProfilePictureController {

    private static final Logger log = LoggerFactory.getLogger(ProfilePictureController.class);

    private final ProfilePictureUploadService uploadService;
    private final ProfilePictureRetentionService retentionService;
    private final AvatarUrlResolver avatarUrlResolver;
    private final AuthenticationGateway authenticationGateway;
    private final Duration uploadTimeout;

    public ProfilePictureController(ProfilePictureUploadService uploadService,
                                    ProfilePictureRetentionService retentionService,
                                    AvatarUrlResolver avatarUrlResolver,
                                    AuthenticationGateway authenticationGateway,
                                    @Value("${media.http.upload-timeout:30s}") Duration uploadTimeout) {
        this.uploadService = uploadService;
        this.retentionService = retentionService;
        this.avatarUrlResolver = avatarUrlResolver;
        this.authenticationGateway = authenticationGateway;
        this.uploadTimeout = uploadTimeout;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProfilePictureUploadResponse> upload(@RequestPart("file") MultipartFile file) {
        SourceFile source;
        try {
            source = SourceFile.of(file.getBytes(), file.getOriginalFilename(), file.getContentType());
        } catch (IOException e) {
            log.warn("Could not read uploaded profile picture '{}': {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(ProfilePictureUploadResponse.error("Unable to read uploaded file"));
        }

        UploadResult result;
        try {
            result = uploadService.upload(source)
                .blockOptional(uploadTimeout)
                .orElseGet(() -> UploadResult.failure("Upload failed", UploadResult.FailureKind.INTERNAL));
        } catch (IllegalStateException timeout) {
            log.error("Profile picture upload exceeded {}: {}", uploadTimeout, timeout.getMessage());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ProfilePictureUploadResponse.error("Upload timed out"));
        }

        return ResponseEntity.status(statusFor(result)).body(ProfilePictureUploadResponse.from(result));
    }

    @DeleteMapping
    public ResponseEntity<ProfilePictureDeleteResponse> delete() {
        Optional<AuthenticatedUser> user = authenticationGateway.getSession().isActive()
            ? authenticationGateway.getCurrentUser()
            : Optional.empty();
        if (user.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ProfilePictureDeleteResponse(false, "User not authenticated", 0));
        }
        ReconciliationResult result = retentionService.reconcile(user.get().id());
        return ResponseEntity.ok(ProfilePictureDeleteResponse.from(result));
    }

    @GetMapping("/url")
    public ResponseEntity<Map<String, String>> resolveUrl(@RequestParam(required = false) String path) {
        return ResponseEntity.ok(Map.of("url", avatarUrlResolver.resolve(path)));
    }

    static HttpStatus statusFor(UploadResult result) {
        if (result instanceof UploadResult.Failure failure) {
            return switch (failure.kind()) {
                case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
                case REJECTED -> HttpStatus.BAD_REQUEST;
                case STORAGE -> HttpStatus.BAD_GATEWAY;
                case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
            };
        }
        return HttpStatus.OK;
    }
}
