package net.profilemedia.service.media;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.profilemedia.model.media.NormalizedFile;
import net.profilemedia.model.media.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Determines the authoritative content type of an upload.
 *
 * <p>Browsers and mobile pickers frequently send {@code application/octet-stream}, nothing at all,
 * or an unrelated type. Such claims are replaced by a lookup on the file extension; unknown
 * extensions fall back to {@code image/jpeg}. Never fails.</p>
 */
@Component
public class MimeTypeResolver {

    private static final Logger logger = LoggerFactory.getLogger(MimeTypeResolver.class);

    public static final String IMAGE_JPEG = "image/jpeg";
    public static final String IMAGE_PNG = "image/png";
    public static final String IMAGE_GIF = "image/gif";
    public static final String IMAGE_WEBP = "image/webp";
    private static final String OCTET_STREAM = "application/octet-stream";

    /** Supported raster types. */
    public static final Set<String> RASTER_TYPES = Set.of(IMAGE_JPEG, IMAGE_PNG, IMAGE_GIF, IMAGE_WEBP);

    private static final Map<String, String> EXTENSION_TYPES = Map.of(
        "jpg", IMAGE_JPEG,
        "jpeg", IMAGE_JPEG,
        "png", IMAGE_PNG,
        "gif", IMAGE_GIF,
        "webp", IMAGE_WEBP
    );

    /**
     * Resolves the content type of {@code file}.
     *
     * @param file upload with untrusted metadata
     * @return the same payload paired with a supported raster type
     */
    public NormalizedFile resolve(SourceFile file) {
        String claimed = normalizeClaimedType(file.contentType());
        if (claimed != null && RASTER_TYPES.contains(claimed)) {
            return new NormalizedFile(file, claimed);
        }

        String inferred = inferFromFileName(file.fileName());
        if (claimed != null && !OCTET_STREAM.equals(claimed)) {
            logger.info("Claimed content type '{}' for '{}' is not a supported image type; using '{}' from the file extension",
                file.contentType(), file.fileName(), inferred);
        } else {
            logger.debug("No usable content type for '{}'; inferred '{}'", file.fileName(), inferred);
        }
        return new NormalizedFile(file, inferred);
    }

    /**
     * Maps a file name's extension to a raster type, {@code image/jpeg} when unknown.
     */
    public String inferFromFileName(String fileName) {
        String extension = extensionOf(fileName);
        if (extension == null) {
            return IMAGE_JPEG;
        }
        return EXTENSION_TYPES.getOrDefault(extension, IMAGE_JPEG);
    }

    public static boolean isRasterType(String contentType) {
        return contentType != null && RASTER_TYPES.contains(contentType);
    }

    /**
     * Lower-cased raster extension of {@code fileName}, or {@code null} when it has none or it is
     * not one of {@code jpg|jpeg|png|gif|webp}.
     */
    static String rasterExtensionOf(String fileName) {
        String extension = extensionOf(fileName);
        return extension != null && EXTENSION_TYPES.containsKey(extension) ? extension : null;
    }

    /**
     * Lower-cased extension without the dot, or {@code null} when the name has none.
     */
    static String extensionOf(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return null;
        }
        String trimmed = fileName.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot < 0 || dot == trimmed.length() - 1) {
            return null;
        }
        return trimmed.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String normalizeClaimedType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return null;
        }
        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        int parameters = normalized.indexOf(';');
        if (parameters >= 0) {
            normalized = normalized.substring(0, parameters).trim();
        }
        // Some clients send the non-standard spelling
        if ("image/jpg".equals(normalized) || "image/pjpeg".equals(normalized)) {
            return IMAGE_JPEG;
        }
        return normalized;
    }
}
