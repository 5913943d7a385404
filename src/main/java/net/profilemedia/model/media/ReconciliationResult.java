package net.profilemedia.model.media;

import java.util.List;
import org.springframework.lang.Nullable;

/**
 * Outcome of pruning an owner's stored profile pictures.
 *
 * <p>A failed reconciliation is a soft failure: the owner's workflow continues, but objects
 * may remain in the bucket until the next successful run.</p>
 *
 * @param success whether listing and removal both completed
 * @param error failure message, {@code null} on success
 * @param removedKeys keys that were removed, empty on failure
 */
public record ReconciliationResult(boolean success, @Nullable String error, List<String> removedKeys) {

    public ReconciliationResult {
        removedKeys = removedKeys == null ? List.of() : List.copyOf(removedKeys);
    }

    public static ReconciliationResult removed(List<String> removedKeys) {
        return new ReconciliationResult(true, null, removedKeys);
    }

    public static ReconciliationResult softFailure(String error) {
        return new ReconciliationResult(false, error == null ? "Delete failed" : error, List.of());
    }
}
