package net.profilemedia.service.media;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import net.profilemedia.model.media.NormalizedFile;
import net.profilemedia.model.media.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MimeTypeResolverTest {

    private static final byte[] PAYLOAD = "image-bytes".getBytes(StandardCharsets.UTF_8);

    private final MimeTypeResolver resolver = new MimeTypeResolver();

    @Test
    void should_KeepClaimedType_When_ClaimIsSupportedRaster() {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, "photo.jpg", "image/png"));

        assertThat(normalized.contentType()).isEqualTo("image/png");
        assertThat(normalized.wasCorrected()).isFalse();
    }

    @Test
    void should_InferPngFromExtension_When_ClaimIsOctetStream() {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, "avatar.png", "application/octet-stream"));

        assertThat(normalized.contentType()).isEqualTo("image/png");
        assertThat(normalized.wasCorrected()).isTrue();
        assertThat(normalized.bytes()).isEqualTo(PAYLOAD);
    }

    @Test
    void should_DefaultToJpeg_When_NoTypeAndNoExtension() {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, "avatar", null));

        assertThat(normalized.contentType()).isEqualTo("image/jpeg");
    }

    @Test
    void should_DefaultToJpeg_When_FileNameMissing() {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, null, ""));

        assertThat(normalized.contentType()).isEqualTo("image/jpeg");
    }

    @Test
    void should_ReplaceNonImageClaim_When_ExtensionIsKnown() {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, "clip.gif", "text/plain"));

        assertThat(normalized.contentType()).isEqualTo("image/gif");
    }

    @Test
    void should_FallBackToJpeg_When_ExtensionIsUnsupported() {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, "scan.bmp", "image/bmp"));

        assertThat(normalized.contentType()).isEqualTo("image/jpeg");
    }

    @ParameterizedTest
    @CsvSource({
        "image/jpg, image/jpeg",
        "image/pjpeg, image/jpeg",
        "IMAGE/PNG, image/png",
        "'image/webp; charset=binary', image/webp"
    })
    void should_NormalizeClaimedSpelling_When_ClaimIsAVariantOfSupportedType(String claimed, String expected) {
        NormalizedFile normalized = resolver.resolve(SourceFile.of(PAYLOAD, "x", claimed));

        assertThat(normalized.contentType()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "photo.JPG, image/jpeg",
        "photo.jpeg, image/jpeg",
        "photo.Png, image/png",
        "anim.gif, image/gif",
        "pic.webp, image/webp",
        "archive.tar.gz, image/jpeg",
        "trailing., image/jpeg"
    })
    void should_MapExtensionCaseInsensitively_When_InferringFromFileName(String fileName, String expected) {
        assertThat(resolver.inferFromFileName(fileName)).isEqualTo(expected);
    }

    @Test
    void should_ReturnNullExtension_When_NameHasNoDot() {
        assertThat(MimeTypeResolver.extensionOf("README")).isNull();
        assertThat(MimeTypeResolver.extensionOf("  ")).isNull();
        assertThat(MimeTypeResolver.extensionOf(" Photo.PNG ")).isEqualTo("png");
    }
}
