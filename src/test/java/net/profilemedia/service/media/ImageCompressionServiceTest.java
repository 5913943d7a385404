package net.profilemedia.service.media;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.CompressionSettings;
import net.profilemedia.model.media.NormalizedFile;
import net.profilemedia.model.media.ProcessedFile;
import net.profilemedia.model.media.SourceFile;
import net.profilemedia.testutil.ImageTestData;
import org.junit.jupiter.api.Test;

class ImageCompressionServiceTest {

    private static final long SMALL_THRESHOLD = 1024L;

    private final ImageCompressionService compressor = new ImageCompressionService(SMALL_THRESHOLD);

    @Test
    void should_DownscaleToBoundingBox_When_ImageExceedsThreshold() {
        byte[] png = ImageTestData.noisePng(600, 600);
        NormalizedFile file = normalized(png, "big.png", "image/png");

        ProcessedFile result = compressor.compress(file, CompressionSettings.defaults());

        assertThat(result.resampled()).isTrue();
        assertThat(result.contentType()).isEqualTo("image/jpeg");
        assertThat(result.width()).isEqualTo(400);
        assertThat(result.height()).isEqualTo(400);
        assertThat(result.size()).isLessThan(png.length);
        assertThat(result.fileName()).isEqualTo("big.png");
        BufferedImage decoded = ImageTestData.decode(result.bytes());
        assertThat(decoded.getWidth()).isEqualTo(400);
        assertThat(decoded.getHeight()).isEqualTo(400);
    }

    @Test
    void should_PreserveAspectRatio_When_ImageIsWide() {
        byte[] png = ImageTestData.noisePng(800, 200);

        ProcessedFile result = compressor.compress(normalized(png, "wide.png", "image/png"), CompressionSettings.defaults());

        assertThat(result.resampled()).isTrue();
        assertThat(result.width()).isEqualTo(400);
        assertThat(result.height()).isEqualTo(100);
    }

    @Test
    void should_BoundHeightToo_When_ImageIsTall() {
        byte[] png = ImageTestData.noisePng(200, 800);

        ProcessedFile result = compressor.compress(normalized(png, "tall.png", "image/png"), CompressionSettings.defaults());

        assertThat(result.width()).isEqualTo(100);
        assertThat(result.height()).isEqualTo(400);
    }

    @Test
    void should_NeverUpscale_When_ImageFitsBoundingBox() {
        byte[] png = ImageTestData.translucentNoisePng(300, 150);

        ProcessedFile result = compressor.compress(normalized(png, "alpha.png", "image/png"), CompressionSettings.defaults());

        assertThat(result.resampled()).isTrue();
        assertThat(result.contentType()).isEqualTo("image/jpeg");
        assertThat(result.width()).isEqualTo(300);
        assertThat(result.height()).isEqualTo(150);
    }

    @Test
    void should_HonourCustomSettings_When_Provided() {
        byte[] png = ImageTestData.noisePng(600, 300);

        ProcessedFile result = compressor.compress(normalized(png, "big.png", "image/png"), new CompressionSettings(120, 0.5f));

        assertThat(result.width()).isEqualTo(120);
        assertThat(result.height()).isEqualTo(60);
    }

    @Test
    void should_PassThroughUnchanged_When_AtOrBelowThreshold() {
        byte[] png = ImageTestData.solidPng(40, 40);
        ImageCompressionService atSize = new ImageCompressionService(png.length);

        ProcessedFile result = atSize.compress(normalized(png, "tiny.png", "image/png"), CompressionSettings.defaults());

        assertThat(result.resampled()).isFalse();
        assertThat(result.bytes()).isEqualTo(png);
        assertThat(result.contentType()).isEqualTo("image/png");
    }

    @Test
    void should_UseDefaultThreshold_When_CreatedFromProperties() {
        ImageCompressionService fromProperties = new ImageCompressionService(new MediaStorageProperties());
        byte[] png = ImageTestData.noisePng(300, 300);

        ProcessedFile result = fromProperties.compress(normalized(png, "mid.png", "image/png"), CompressionSettings.defaults());

        assertThat(png.length).isLessThan(1024 * 1024);
        assertThat(result.resampled()).isFalse();
        assertThat(result.bytes()).isEqualTo(png);
    }

    @Test
    void should_ReturnTypeCorrectedOriginal_When_BytesAreNotAnImage() {
        byte[] garbage = ImageTestData.garbage(4096);

        ProcessedFile result = compressor.compress(normalized(garbage, "fake.png", "image/png"), CompressionSettings.defaults());

        assertThat(result.resampled()).isFalse();
        assertThat(result.bytes()).isEqualTo(garbage);
        assertThat(result.contentType()).isEqualTo("image/png");
    }

    @Test
    void should_KeepOriginal_When_ReencodingIsNotSmaller() {
        byte[] png = ImageTestData.solidPng(50, 50);
        ImageCompressionService alwaysCompress = new ImageCompressionService(0L);

        ProcessedFile result = alwaysCompress.compress(normalized(png, "flat.png", "image/png"), CompressionSettings.defaults());

        assertThat(result.resampled()).isFalse();
        assertThat(result.bytes()).isEqualTo(png);
        assertThat(result.contentType()).isEqualTo("image/png");
    }

    @Test
    void should_ForceJpegType_When_ResolvedTypeIsNotRaster() {
        byte[] png = ImageTestData.solidPng(10, 10);
        NormalizedFile file = new NormalizedFile(SourceFile.of(png, "scan.bmp", "image/bmp"), "image/bmp");

        ProcessedFile result = new ImageCompressionService(1024L * 1024L).compress(file, CompressionSettings.defaults());

        assertThat(result.contentType()).isEqualTo("image/jpeg");
        assertThat(result.bytes()).isEqualTo(png);
    }

    @Test
    void should_DetectDecodablePayloads() {
        assertThat(compressor.isDecodable(ImageTestData.solidPng(5, 5))).isTrue();
        assertThat(compressor.isDecodable(ImageTestData.garbage(256))).isFalse();
        assertThat(compressor.isDecodable(new byte[0])).isFalse();
        assertThat(compressor.isDecodable(null)).isFalse();
    }

    @Test
    void should_SubsampleWhileDecoding_When_HeaderDeclaresHugeDimensions() {
        // 16000x16000 would need 256 MB as a decoded gray raster
        byte[] png = ImageTestData.blankGrayPng(16_000, 16_000);

        ProcessedFile result = compressor.compress(normalized(png, "huge.png", "image/png"), CompressionSettings.defaults());

        assertThat(png.length).isLessThan(5 * 1024 * 1024);
        assertThat(result.resampled()).isTrue();
        assertThat(result.contentType()).isEqualTo("image/jpeg");
        assertThat(result.width()).isEqualTo(400);
        assertThat(result.height()).isEqualTo(400);
        assertThat(result.size()).isLessThan(png.length);
        assertThat(compressor.isDecodable(png)).isTrue();
    }

    @Test
    void should_PickSubsamplingStep_From_LongestEdge() {
        assertThat(ImageCompressionService.subsamplingStep(30_000, 30_000, 800)).isEqualTo(37);
        assertThat(ImageCompressionService.subsamplingStep(100, 16_000, 800)).isEqualTo(20);
        assertThat(ImageCompressionService.subsamplingStep(800, 600, 800)).isEqualTo(1);
        assertThat(ImageCompressionService.subsamplingStep(1601, 10, 800)).isEqualTo(2);
    }

    private static NormalizedFile normalized(byte[] bytes, String fileName, String contentType) {
        return new NormalizedFile(SourceFile.of(bytes, fileName, contentType), contentType);
    }
}
