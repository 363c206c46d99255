package com.libragraph.framekit.util.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Tunables for the digest layer, read through MicroProfile Config.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties};
 * system properties and environment variables override them as usual.
 */
public final class FramekitSettings {

    public static final String READ_CHUNK_KEY = "framekit.digest.read-chunk-bytes";

    static final int DEFAULT_READ_CHUNK = 8192;

    private FramekitSettings() {
    }

    /**
     * Read size used when digesting a channel.
     */
    public static int readChunkBytes() {
        return readChunkBytes(ConfigProvider.getConfig());
    }

    static int readChunkBytes(Config config) {
        int value = config.getOptionalValue(READ_CHUNK_KEY, Integer.class)
                .orElse(DEFAULT_READ_CHUNK);
        if (value <= 0) {
            throw new IllegalArgumentException(READ_CHUNK_KEY + " must be > 0, got: " + value);
        }
        return value;
    }
}
