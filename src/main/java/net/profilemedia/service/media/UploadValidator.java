package net.profilemedia.service.media;

import java.util.Locale;
import java.util.Optional;
import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.SourceFile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rejects uploads that must never reach processing.
 */
@Component
public class UploadValidator {

    private static final long BYTES_PER_KIB = 1024L;
    private static final long BYTES_PER_MIB = 1024L * BYTES_PER_KIB;

    private final long maxUploadBytes;

    @Autowired
    public UploadValidator(MediaStorageProperties properties) {
        this(properties.getMaxUploadBytes());
    }

    UploadValidator(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    /**
     * @return a user-facing rejection message, empty when the file is acceptable
     */
    public Optional<String> validate(SourceFile file) {
        if (file == null || file.isEmpty()) {
            return Optional.of("File is empty");
        }
        if (file.size() > maxUploadBytes) {
            return Optional.of("File size must be less than " + formatLimit(maxUploadBytes));
        }
        return Optional.empty();
    }

    /**
     * Whole MiB as {@code 5MB}, fractional MiB with one decimal, limits under 1 MiB in KB.
     */
    static String formatLimit(long bytes) {
        if (bytes < BYTES_PER_MIB) {
            return Math.max(1L, bytes / BYTES_PER_KIB) + "KB";
        }
        if (bytes % BYTES_PER_MIB == 0) {
            return bytes / BYTES_PER_MIB + "MB";
        }
        return String.format(Locale.ROOT, "%.1fMB", (double) bytes / BYTES_PER_MIB);
    }
}
