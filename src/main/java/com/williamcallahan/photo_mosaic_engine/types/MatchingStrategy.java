package com.williamcallahan.photo_mosaic_engine.types;

import java.util.Locale;

/**
 * How a grid cell is compared against the tiles in the index.
 */
public enum MatchingStrategy {
    /** Nearest average color; O(1) per tile comparison. */
    COLOR("color"),
    /** Lowest variance of the per-pixel difference image; O(pixels) per tile comparison. */
    IMAGE_VARIANCE("image-variance");

    private final String configValue;

    MatchingStrategy(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() {
        return configValue;
    }

    /**
     * Parses either the configuration spelling ({@code image-variance}) or the enum name ({@code IMAGE_VARIANCE}).
     *
     * @throws IllegalArgumentException when the value names no strategy
     */
    public static MatchingStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Matching strategy must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (MatchingStrategy strategy : values()) {
            if (strategy.configValue.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown matching strategy: " + value);
    }
}
