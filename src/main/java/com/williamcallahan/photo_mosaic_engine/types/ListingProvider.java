package com.williamcallahan.photo_mosaic_engine.types;

import java.util.Locale;

public enum ListingProvider {
    REDDIT("Reddit"),
    IMGUR("Imgur");

    private final String displayName;

    ListingProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static ListingProvider fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Listing provider must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown listing provider: " + value, e);
        }
    }
}
