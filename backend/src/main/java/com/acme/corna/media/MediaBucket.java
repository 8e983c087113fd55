package com.acme.corna.media;

import java.util.Arrays;
import java.util.Locale;

/**
 * Top-level storage directory for a class of media.
 */
public enum MediaBucket {
    IMAGE,
    VIDEO,
    AVATAR,
    THUMBNAIL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MediaBucket fromValue(String value) {
        if (value == null || value.isBlank()) return IMAGE;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(b -> b.name().equals(normalized)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown media type '" + value + "'"));
    }
}
