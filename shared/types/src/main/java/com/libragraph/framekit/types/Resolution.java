package com.libragraph.framekit.types;

import java.util.Objects;

/**
 * Pixel dimensions of a display mode or render target.
 *
 * <p>String format: {@code {width}x{height}}, e.g. {@code 1920x1080}.
 */
public record Resolution(int width, int height) {

    public Resolution {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                "Resolution dimensions must be >= 0, got: " + width + "x" + height
            );
        }
    }

    /**
     * Parses the {@code {width}x{height}} form produced by {@link #toResolutionString()}.
     *
     * @throws IllegalArgumentException if the format is invalid
     */
    public static Resolution parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");

        int sep = text.indexOf('x');
        if (sep <= 0 || sep == text.length() - 1) {
            throw new IllegalArgumentException("Invalid resolution (expected WxH): " + text);
        }

        try {
            int width = Integer.parseInt(text.substring(0, sep));
            int height = Integer.parseInt(text.substring(sep + 1));
            return new Resolution(width, height);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid resolution (bad number): " + text, e);
        }
    }

    public String toResolutionString() {
        return width + "x" + height;
    }

    @Override
    public String toString() {
        return toResolutionString();
    }
}
