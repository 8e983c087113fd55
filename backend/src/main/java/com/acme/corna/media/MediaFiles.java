package com.acme.corna.media;

import java.util.Locale;
import java.util.Set;

public final class MediaFiles {
    static final Set<String> IMAGE_EXT = Set.of("gif", "jpg", "jpeg", "png", "webp");
    static final Set<String> VIDEO_EXT = Set.of("avi", "flv", "mkv", "mp4", "mov", "wmv");

    private MediaFiles() {}

    public static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isImage(String filename) {
        return IMAGE_EXT.contains(extension(filename));
    }

    public static boolean isVideo(String filename) {
        return VIDEO_EXT.contains(extension(filename));
    }

    public static boolean isAllowed(String filename) {
        return isImage(filename) || isVideo(filename);
    }

    /**
     * Reduces a client supplied name to ASCII letters, digits, '.', '_' and '-' with no
     * leading dots, so it is safe as a single path segment.
     */
    public static String secureFilename(String filename) {
        if (filename == null) return "";
        String base = filename.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        String cleaned = base.trim().replaceAll("\\s+", "_").replaceAll("[^A-Za-z0-9._-]", "");
        return cleaned.replaceAll("^[._]+", "");
    }

    /**
     * Spreads files over nested directories: {@code b064a10c720b...} becomes
     * {@code b06/4a1/0c7/20b...}.
     */
    public static String hashToDir(String hash) {
        if (hash == null || hash.length() < 10) {
            throw new IllegalArgumentException("Hash too short for directory layout");
        }
        return hash.substring(0, 3) + "/" + hash.substring(3, 6) + "/" + hash.substring(6, 9) + "/" + hash.substring(9);
    }
}
