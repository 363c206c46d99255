package com.libragraph.framekit.util.config;

import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FramekitSettingsTest {

    @Test
    void shouldReadShippedDefaults() {
        assertThat(FramekitSettings.readChunkBytes()).isEqualTo(8192);
    }

    @Test
    void shouldFallBackWhenKeysAreMissing() {
        SmallRyeConfig empty = new SmallRyeConfigBuilder().build();

        assertThat(FramekitSettings.readChunkBytes(empty))
                .isEqualTo(FramekitSettings.DEFAULT_READ_CHUNK);
    }

    @Test
    void shouldUseConfiguredValues() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withDefaultValue(FramekitSettings.READ_CHUNK_KEY, "16")
                .build();

        assertThat(FramekitSettings.readChunkBytes(config)).isEqualTo(16);
    }

    @Test
    void shouldRejectNonPositiveValues() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withDefaultValue(FramekitSettings.READ_CHUNK_KEY, "-5")
                .build();

        assertThatIllegalArgumentException()
                .isThrownBy(() -> FramekitSettings.readChunkBytes(config))
                .withMessageContaining(FramekitSettings.READ_CHUNK_KEY)
                .withMessageContaining("-5");
    }
}
