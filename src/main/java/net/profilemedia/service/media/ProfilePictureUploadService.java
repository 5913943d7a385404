package net.profilemedia.service.media;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.Optional;
import net.profilemedia.auth.AuthenticatedUser;
import net.profilemedia.auth.AuthenticationGateway;
import net.profilemedia.auth.SessionStatus;
import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.CompressionSettings;
import net.profilemedia.model.media.ForcedTypePolicy;
import net.profilemedia.model.media.NormalizedFile;
import net.profilemedia.model.media.ProcessedFile;
import net.profilemedia.model.media.SourceFile;
import net.profilemedia.model.media.StorageKey;
import net.profilemedia.model.media.UploadResult;
import net.profilemedia.model.media.UploadResult.FailureKind;
import net.profilemedia.support.storage.ObjectStoreClient;
import net.profilemedia.support.storage.StoreOperationResult;
import net.profilemedia.support.storage.UploadOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Uploads a user's profile picture and returns its public URL.
 *
 * <p>Pipeline: session check, principal check, validation, content type resolution, compression,
 * key generation, upsert upload, public URL lookup. Every outcome is an {@link UploadResult};
 * no exception leaves {@link #upload(SourceFile, String)}.</p>
 *
 * <p>Superseded pictures are not removed here. Callers that want pruning invoke
 * {@link ProfilePictureRetentionService} separately so uploads never wait on cleanup.</p>
 */
@Service
public class ProfilePictureUploadService {

    private static final Logger log = LoggerFactory.getLogger(ProfilePictureUploadService.class);
    static final String UPLOAD_METRIC = "profile_media.uploads";

    private final AuthenticationGateway authenticationGateway;
    private final UploadValidator uploadValidator;
    private final MimeTypeResolver mimeTypeResolver;
    private final ImageCompressionService imageCompressionService;
    private final StorageKeyBuilder storageKeyBuilder;
    private final ObjectStoreClient objectStoreClient;
    private final MeterRegistry meterRegistry;
    private final String bucket;
    private final CompressionSettings compressionSettings;
    private final ForcedTypePolicy forcedTypePolicy;
    private final UploadOptions uploadOptions;

    public ProfilePictureUploadService(AuthenticationGateway authenticationGateway,
                                       UploadValidator uploadValidator,
                                       MimeTypeResolver mimeTypeResolver,
                                       ImageCompressionService imageCompressionService,
                                       StorageKeyBuilder storageKeyBuilder,
                                       ObjectStoreClient objectStoreClient,
                                       MediaStorageProperties properties,
                                       MeterRegistry meterRegistry) {
        this.authenticationGateway = authenticationGateway;
        this.uploadValidator = uploadValidator;
        this.mimeTypeResolver = mimeTypeResolver;
        this.imageCompressionService = imageCompressionService;
        this.storageKeyBuilder = storageKeyBuilder;
        this.objectStoreClient = objectStoreClient;
        this.meterRegistry = meterRegistry;
        this.bucket = properties.getBucket();
        this.compressionSettings = properties.compressionSettings();
        this.forcedTypePolicy = properties.getForcedTypePolicy();
        this.uploadOptions = UploadOptions.upsert(properties.getCacheControlSeconds());
    }

    /**
     * Uploads {@code file} as the authenticated user's profile picture.
     */
    public Mono<UploadResult> upload(SourceFile file) {
        return upload(file, null);
    }

    /**
     * Uploads {@code file} for {@code ownerId}.
     *
     * <p>The session is checked on the calling thread, where the security context lives; the
     * remaining CPU and network work runs on the bounded elastic scheduler.</p>
     *
     * @param file raw upload
     * @param ownerId expected owner; must equal the authenticated principal when given
     * @return the stored object's URL, or the reason the upload failed
     */
    public Mono<UploadResult> upload(SourceFile file, @Nullable String ownerId) {
        String verifiedOwner;
        try {
            SessionStatus session = authenticationGateway.getSession();
            if (!session.isActive()) {
                log.warn("Rejected profile picture upload: no valid session ({})", session.error());
                return Mono.just(record(UploadResult.failure("Authentication failed: " + session.error(), FailureKind.AUTHENTICATION)));
            }
            Optional<AuthenticatedUser> user = authenticationGateway.getCurrentUser();
            if (user.isEmpty()) {
                log.warn("Rejected profile picture upload: session has no resolvable principal");
                return Mono.just(record(UploadResult.failure("User not authenticated", FailureKind.AUTHENTICATION)));
            }
            verifiedOwner = user.get().id();
            if (ownerId != null && !ownerId.equals(verifiedOwner)) {
                log.warn("Rejected profile picture upload: requested owner {} differs from principal {}", ownerId, verifiedOwner);
                return Mono.just(record(UploadResult.failure("Owner does not match authenticated user", FailureKind.AUTHENTICATION)));
            }
        } catch (RuntimeException authFailure) {
            log.error("Authentication check failed: {}", authFailure.getMessage(), authFailure);
            return Mono.just(record(UploadResult.failure(
                "Authentication failed: " + messageOf(authFailure), FailureKind.AUTHENTICATION)));
        }

        return Mono.fromCallable(() -> store(file, verifiedOwner))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(unexpected -> {
                log.error("Profile picture upload for {} failed unexpectedly: {}",
                    verifiedOwner, unexpected.getMessage(), unexpected);
                return Mono.just(UploadResult.failure(messageOf(unexpected), FailureKind.INTERNAL));
            })
            .map(this::record);
    }

    private UploadResult store(SourceFile file, String ownerId) {
        Optional<String> rejection = uploadValidator.validate(file);
        if (rejection.isPresent()) {
            log.info("Rejected profile picture upload for {}: {}", ownerId, rejection.get());
            return UploadResult.failure(rejection.get(), FailureKind.REJECTED);
        }

        NormalizedFile normalized = mimeTypeResolver.resolve(file);
        if (forcedTypePolicy == ForcedTypePolicy.REQUIRE_DECODABLE
            && normalized.wasCorrected()
            && !imageCompressionService.isDecodable(normalized.bytes())) {
            log.warn("Rejected profile picture upload for {}: '{}' claimed '{}' and does not decode as an image",
                ownerId, file.fileName(), file.contentType());
            return UploadResult.failure("Unsupported image content", FailureKind.REJECTED);
        }

        ProcessedFile processed = imageCompressionService.compress(normalized, compressionSettings);
        StorageKey key = storageKeyBuilder.build(ownerId, file.fileName());
        if (!storageKeyBuilder.isOwnedBy(key.value(), ownerId)) {
            log.error("Generated key {} escapes the owner segment of {}; refusing to upload", key, ownerId);
            return UploadResult.failure("Invalid storage key", FailureKind.INTERNAL);
        }

        StoreOperationResult uploadResult = objectStoreClient.upload(
            bucket, key.value(), processed.bytes(), processed.contentType(), uploadOptions);
        if (!uploadResult.isSuccess()) {
            String message = uploadResult.getErrorMessage().orElse("Upload failed");
            log.error("Profile picture upload for {} to {} failed: {}", ownerId, key, message);
            return UploadResult.failure(message, FailureKind.STORAGE);
        }

        Optional<String> publicUrl = objectStoreClient.getPublicUrl(bucket, key.value());
        if (publicUrl.isEmpty() || publicUrl.get().isBlank()) {
            // The object stays in the bucket; the next reconciliation removes it
            log.error("Stored {} for {} but the store produced no public URL", key, ownerId);
            return UploadResult.failure("Failed to get public URL", FailureKind.STORAGE);
        }

        log.info("Stored profile picture for {} at {} ({} bytes, {}, resampled={})",
            ownerId, key, processed.size(), processed.contentType(), processed.resampled());
        return UploadResult.success(publicUrl.get(), key.value());
    }

    private UploadResult record(UploadResult result) {
        String outcome = result instanceof UploadResult.Failure failure
            ? failure.kind().name().toLowerCase(Locale.ROOT)
            : "success";
        meterRegistry.counter(UPLOAD_METRIC, "outcome", outcome).increment();
        return result;
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? "Upload failed" : message;
    }
}
