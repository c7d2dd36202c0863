package com.mosaic.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.net.URI;
import java.util.List;

/**
 * Immutable settings of one enrichment dispatcher: where to send previews and where to
 * store the answer. One instance is built per feature at startup.
 */
@Value
public class EnrichmentConfig {

    /** Human readable feature name used in log lines, e.g. {@code object detection}. */
    String name;
    String apiServerUrl;
    String apiPath;

    /** Acceptable input suffixes in order of preference. */
    List<String> imagePreviewSuffixes;

    /** Suffix the API response is stored under. */
    String entrySuffix;
    int concurrent;

    /** Request timeout in seconds. */
    int timeout;

    @Builder
    private EnrichmentConfig(String name, String apiServerUrl, String apiPath,
                             @Singular List<String> imagePreviewSuffixes, String entrySuffix,
                             int concurrent, int timeout) {
        this.name = requireText(name, "name");
        this.apiServerUrl = requireText(apiServerUrl, "apiServerUrl");
        this.apiPath = requireText(apiPath, "apiPath");
        this.entrySuffix = requireText(entrySuffix, "entrySuffix");
        if (imagePreviewSuffixes == null || imagePreviewSuffixes.isEmpty()) {
            throw new IllegalArgumentException("No image preview suffixes configured for " + name);
        }
        if (concurrent <= 0) {
            throw new IllegalArgumentException("concurrent must be positive for " + name + ": " + concurrent);
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive for " + name + ": " + timeout);
        }
        requireHttpUrl(this.apiServerUrl + this.apiPath, name);
        this.imagePreviewSuffixes = List.copyOf(imagePreviewSuffixes);
        this.concurrent = concurrent;
        this.timeout = timeout;
    }

    public String getUrl() {
        return apiServerUrl + apiPath;
    }

    private static void requireHttpUrl(String url, String name) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid api server url for " + name + ": " + url, e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Api server url for " + name + " must be http(s): " + url);
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
