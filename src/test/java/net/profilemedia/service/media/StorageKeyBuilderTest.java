package net.profilemedia.service.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import net.profilemedia.config.MediaStorageProperties;
import net.profilemedia.model.media.StorageKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StorageKeyBuilderTest {

    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_718_000_000_000L), ZoneOffset.UTC);

    @Test
    void should_BuildOwnerScopedKey_When_FileHasExtension() {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);

        StorageKey key = builder.build("3f2c9a", "me.PNG");

        assertThat(key.value()).isEqualTo("profile-pictures/3f2c9a/3f2c9a_1718000000000.png");
        assertThat(key.ownerId()).isEqualTo("3f2c9a");
        assertThat(key.fileName()).startsWith("3f2c9a_");
    }

    @Test
    void should_DefaultToJpgExtension_When_FileNameHasNone() {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);

        assertThat(builder.build("u1", "avatar").value()).isEqualTo("profile-pictures/u1/u1_1718000000000.jpg");
        assertThat(builder.build("u1", null).value()).isEqualTo("profile-pictures/u1/u1_1718000000000.jpg");
    }

    @Test
    void should_ProduceDistinctKeys_When_ClockAdvances() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenReturn(1000L, 1001L);
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", clock);

        String first = builder.build("u1", "a.jpg").value();
        String second = builder.build("u1", "a.jpg").value();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void should_ReturnSameKey_When_ClockAndExtensionMatch() {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);

        assertThat(builder.build("u1", "a.jpg")).isEqualTo(builder.build("u1", "b.JPG"));
    }

    @Test
    void should_TrimSlashes_When_FolderIsConfiguredWithThem() {
        StorageKeyBuilder builder = new StorageKeyBuilder("/avatars/", FIXED);

        assertThat(builder.ownerPrefix("u1")).isEqualTo("avatars/u1/");
    }

    @Test
    void should_ReadFolderFromProperties_When_CreatedBySpring() {
        MediaStorageProperties properties = new MediaStorageProperties();
        properties.setFolder("custom");

        StorageKeyBuilder builder = new StorageKeyBuilder(properties, FIXED);

        assertThat(builder.build("u1", "x.gif").value()).isEqualTo("custom/u1/u1_1718000000000.gif");
    }

    @Test
    void should_RejectOwnerId_When_BlankOrContainsSlash() {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);

        assertThatThrownBy(() -> builder.build(" ", "a.jpg")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build("a/b", "a.jpg")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.ownerPrefix(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_RejectFolder_When_Blank() {
        assertThatThrownBy(() -> new StorageKeyBuilder("/", FIXED)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_MatchOnlyOwnSegment_When_CheckingOwnership() {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);
        String key = builder.build("u1", "a.jpg").value();

        assertThat(builder.isOwnedBy(key, "u1")).isTrue();
        assertThat(builder.isOwnedBy(key, "u")).isFalse();
        assertThat(builder.isOwnedBy("profile-pictures/u10/u10_1.jpg", "u1")).isFalse();
        assertThat(builder.isOwnedBy(null, "u1")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a./x/y", "a.png?v=1#frag", "a.jp g", "shell.php", "a.PNG/../../b", "trailing."})
    void should_FallBackToJpg_When_ExtensionIsNotAKnownRasterType(String hostileName) {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);

        StorageKey key = builder.build("u1", hostileName);

        assertThat(key.value()).isEqualTo("profile-pictures/u1/u1_1718000000000.jpg");
        assertThat(builder.isOwnedBy(key.value(), "u1")).isTrue();
    }

    @Test
    void should_KeepKnownRasterExtensions_When_CaseDiffers() {
        StorageKeyBuilder builder = new StorageKeyBuilder("profile-pictures", FIXED);

        assertThat(builder.build("u1", "a.JPEG").fileName()).isEqualTo("u1_1718000000000.jpeg");
        assertThat(builder.build("u1", "a.WebP").fileName()).isEqualTo("u1_1718000000000.webp");
        assertThat(builder.build("u1", " spaced name.gif ").fileName()).isEqualTo("u1_1718000000000.gif");
    }
}
