package com.mosaic.enrichment;

import java.util.Locale;

/**
 * Naming of preview image artifacts.
 */
public final class ImagePreviewSuffix {

    private ImagePreviewSuffix() {
        // utility class
    }

    public static String ofSize(int size) {
        return "image-preview-" + size + ".jpg";
    }

    /**
     * Media type to announce when uploading the artifact with the given suffix.
     */
    public static String contentType(String suffix) {
        String lower = suffix.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        } else if (lower.endsWith(".png")) {
            return "image/png";
        } else if (lower.endsWith(".webp")) {
            return "image/webp";
        }
        return "application/octet-stream";
    }
}
