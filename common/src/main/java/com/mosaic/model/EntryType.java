package com.mosaic.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Media classifier of a catalog {@link Entry}.
 */
public enum EntryType {

    IMAGE("image"),

    RAW_IMAGE("rawImage"),

    VIDEO("video"),

    OTHER("other");

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "webp", "gif", "heic", "heif", "tif", "tiff");
    private static final Set<String> RAW_EXTENSIONS = Set.of(
            "cr2", "cr3", "nef", "arw", "dng", "orf", "rw2", "raf", "pef", "srw");
    private static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mp4", "mov", "m4v", "avi", "mkv", "webm");

    private final String value;

    EntryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Classifies a file by its extension, case-insensitive. Files without a
     * known extension are {@link #OTHER}.
     */
    public static EntryType fromFilename(String filename) {
        if (filename == null) {
            return OTHER;
        }
        int dot = filename.lastIndexOf('.');
        int slash = filename.lastIndexOf('/');
        if (dot < 0 || dot < slash) {
            return OTHER;
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (IMAGE_EXTENSIONS.contains(extension)) {
            return IMAGE;
        } else if (RAW_EXTENSIONS.contains(extension)) {
            return RAW_IMAGE;
        } else if (VIDEO_EXTENSIONS.contains(extension)) {
            return VIDEO;
        }
        return OTHER;
    }
}
