/**
 * Service for pruning superseded profile pictures
 *
 * Features:
 * - Lists one owner's objects under {folder}/{ownerId}/ with a bounded page
 * - Only removes objects whose file name starts with {ownerId}_
 * - Optionally keeps the object that was just uploaded
 * - Issues a single bulk delete per run
 * - Reports failures as a soft result and a metric instead of throwing
 */
package net.profilemedia.service.media;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.ReconciliationResult;
import net.profilemedia.support.storage.ObjectStoreClient;
import net.profilemedia.support.storage.StoreOperationResult;
import net.profilemedia.support.storage.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
public class ProfilePictureRetentionService {

    private static final Logger logger = LoggerFactory.getLogger(ProfilePictureRetentionService.class);
    static final String RECONCILE_METRIC = "profile_media.reconciliations";

    private final ObjectStoreClient objectStoreClient;
    private final StorageKeyBuilder storageKeyBuilder;
    private final MeterRegistry meterRegistry;
    private final String bucket;
    private final int listLimit;

    public ProfilePictureRetentionService(ObjectStoreClient objectStoreClient,
                                          StorageKeyBuilder storageKeyBuilder,
                                          MediaStorageProperties properties,
                                          MeterRegistry meterRegistry) {
        this.objectStoreClient = objectStoreClient;
        this.storageKeyBuilder = storageKeyBuilder;
        this.meterRegistry = meterRegistry;
        this.bucket = properties.getBucket();
        this.listLimit = properties.getListLimit();
    }

    /**
     * Removes every stored profile picture of {@code ownerId}.
     *
     * @param ownerId owner whose objects are removed
     * @return removed keys, or a soft failure
     */
    public ReconciliationResult reconcile(String ownerId) {
        return reconcile(ownerId, null);
    }

    /**
     * Removes the stored profile pictures of {@code ownerId} except {@code keepKey}.
     *
     * @param ownerId owner whose objects are removed
     * @param keepKey key to leave in place, typically the upload that just succeeded
     * @return removed keys, or a soft failure
     */
    public ReconciliationResult reconcile(String ownerId, @Nullable String keepKey) {
        try {
            String prefix = storageKeyBuilder.ownerPrefix(ownerId);
            List<StoredObject> listed = objectStoreClient.list(bucket, prefix, listLimit);
            List<StoredObject> superseded = listed.stream()
                .filter(object -> storageKeyBuilder.isOwnedBy(object.key(), ownerId))
                .filter(object -> object.name().startsWith(ownerId + "_"))
                .filter(object -> !object.key().equals(keepKey))
                .toList();
            List<String> toRemove = superseded.stream().map(StoredObject::key).toList();
            long bytesToFree = superseded.stream()
                .map(StoredObject::sizeBytes)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();

            logger.info("Reconciling profile pictures for {}: {} listed under '{}', {} to remove ({} bytes)",
                ownerId, listed.size(), prefix, toRemove.size(), bytesToFree);
            if (toRemove.isEmpty()) {
                return recordOutcome(ReconciliationResult.removed(List.of()));
            }

            StoreOperationResult removal = objectStoreClient.remove(bucket, toRemove);
            if (!removal.isSuccess()) {
                String message = removal.getErrorMessage().orElse("Delete failed");
                logger.warn("Could not remove {} superseded profile picture(s) for {}: {}", toRemove.size(), ownerId, message);
                return recordOutcome(ReconciliationResult.softFailure(message));
            }
            return recordOutcome(ReconciliationResult.removed(toRemove));
        } catch (RuntimeException e) {
            logger.warn("Error reconciling profile pictures for {}: {}", ownerId, e.getMessage(), e);
            return recordOutcome(ReconciliationResult.softFailure(e.getMessage()));
        }
    }

    private ReconciliationResult recordOutcome(ReconciliationResult result) {
        meterRegistry.counter(RECONCILE_METRIC, "outcome", result.success() ? "success" : "soft_failure").increment();
        return result;
    }
}
