package net.profilemedia.service.media;

import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.CompressionSettings;
import net.profilemedia.model.media.NormalizedFile;
import net.profilemedia.model.media.ProcessedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Normalizes and shrinks profile pictures before upload
 *
 * Features:
 * - Forces a supported raster content type onto every payload
 * - Leaves payloads at or below the threshold untouched
 * - Downscales larger images to fit a square bounding box, never upscaling
 * - Subsamples while decoding, so declared dimensions never size the decoded raster
 * - Re-encodes resampled images as RGB JPEG at the configured quality
 * - Falls back to the type-corrected original whenever decoding or encoding fails
 */
@Service
public class ImageCompressionService {

    private static final Logger logger = LoggerFactory.getLogger(ImageCompressionService.class);

    // Decoded edge is kept at up to twice the target so the final bilinear pass still has detail
    private static final int DECODE_OVERSAMPLING = 2;
    private static final int DECODABILITY_CHECK_EDGE = 64;

    private final long compressionThresholdBytes;

    @Autowired
    public ImageCompressionService(MediaStorageProperties properties) {
        this(properties.getCompressionThresholdBytes());
    }

    ImageCompressionService(long compressionThresholdBytes) {
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    /**
     * Produces the payload to store for {@code file}.
     *
     * @param file upload with its resolved content type
     * @param settings bounding box and JPEG quality
     * @return the resampled JPEG, or the type-corrected original when no resampling applies or it fails
     */
    public ProcessedFile compress(NormalizedFile file, CompressionSettings settings) {
        ProcessedFile typeCorrected = ProcessedFile.passThrough(file, enforceRasterType(file));

        if (file.size() <= compressionThresholdBytes) {
            logger.debug("'{}' is {} bytes (threshold {}); storing without resampling",
                file.fileName(), file.size(), compressionThresholdBytes);
            return typeCorrected;
        }

        try {
            DecodedImage decoded = decode(file.bytes(), settings.maxWidth() * DECODE_OVERSAMPLING);
            if (decoded == null) {
                logger.warn("Could not decode '{}' ({} bytes) as an image; storing original bytes",
                    file.fileName(), file.size());
                return typeCorrected;
            }

            BufferedImage original = decoded.image();
            int originalWidth = decoded.sourceWidth();
            int originalHeight = decoded.sourceHeight();
            double scale = Math.min(1.0, Math.min(
                (double) settings.maxWidth() / originalWidth,
                (double) settings.maxWidth() / originalHeight));
            int targetWidth = Math.max(1, (int) Math.round(originalWidth * scale));
            int targetHeight = Math.max(1, (int) Math.round(originalHeight * scale));

            BufferedImage output = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
            Graphics2D g2d = output.createGraphics();
            try {
                g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
                g2d.drawImage(original, 0, 0, targetWidth, targetHeight, null);
            } finally {
                g2d.dispose();
            }

            byte[] encoded = encodeJpeg(output, settings.quality());
            if (encoded == null) {
                return typeCorrected;
            }
            if (encoded.length >= file.size()) {
                logger.info("Re-encoded '{}' is not smaller ({} >= {} bytes); storing original bytes",
                    file.fileName(), encoded.length, file.size());
                return typeCorrected;
            }

            logger.info("Compressed '{}' from {}x{} ({} bytes) to {}x{} ({} bytes)",
                file.fileName(), originalWidth, originalHeight, file.size(), targetWidth, targetHeight, encoded.length);
            return ProcessedFile.resampled(encoded, file.fileName(), targetWidth, targetHeight);
        } catch (IOException e) {
            logger.warn("IOException while compressing '{}': {}; storing original bytes", file.fileName(), e.getMessage(), e);
            return typeCorrected;
        } catch (RuntimeException e) {
            logger.warn("Unexpected error while compressing '{}': {}; storing original bytes", file.fileName(), e.getMessage(), e);
            return typeCorrected;
        }
    }

    /**
     * Whether {@code bytes} can be decoded by the installed ImageIO readers.
     */
    public boolean isDecodable(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return false;
        }
        try {
            return decode(bytes, DECODABILITY_CHECK_EDGE) != null;
        } catch (IOException | RuntimeException e) {
            logger.debug("Payload of {} bytes is not decodable: {}", bytes.length, e.getMessage());
            return false;
        }
    }

    private String enforceRasterType(NormalizedFile file) {
        if (MimeTypeResolver.isRasterType(file.contentType())) {
            return file.contentType();
        }
        logger.warn("Relabelling '{}' from '{}' to '{}' without inspecting its bytes",
            file.fileName(), file.contentType(), MimeTypeResolver.IMAGE_JPEG);
        return MimeTypeResolver.IMAGE_JPEG;
    }

    /**
     * Decodes the first frame, subsampling on read so the decoded raster's longer edge stays near
     * {@code maxDecodedEdge} whatever the declared dimensions are.
     *
     * @return the decoded frame with the source dimensions from the header, or {@code null} when no
     *         installed reader accepts the bytes
     */
    private static DecodedImage decode(byte[] bytes, int maxDecodedEdge) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (input == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                int step = subsamplingStep(width, height, maxDecodedEdge);
                ImageReadParam param = reader.getDefaultReadParam();
                if (step > 1) {
                    logger.debug("Subsampling {}x{} source by {} while decoding", width, height, step);
                    param.setSourceSubsampling(step, step, 0, 0);
                }
                BufferedImage image = reader.read(0, param);
                return image == null ? null : new DecodedImage(image, width, height);
            } finally {
                reader.dispose();
            }
        }
    }

    static int subsamplingStep(int width, int height, int maxDecodedEdge) {
        int longest = Math.max(width, height);
        if (maxDecodedEdge <= 0 || longest <= maxDecodedEdge) {
            return 1;
        }
        return longest / maxDecodedEdge;
    }

    private record DecodedImage(BufferedImage image, int sourceWidth, int sourceHeight) {
    }

    private static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            logger.error("No JPEG ImageWriters found. Cannot compress image.");
            return null;
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageWriteParam jpegParams = writer.getDefaultWriteParam();
            jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            jpegParams.setCompressionQuality(quality);

            try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(image, null, null), jpegParams);
            }
            return baos.toByteArray();
        } finally {
            writer.dispose();
        }
    }
}
