package com.mosaic.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings of the remote inference API shared by all api-server enrichers.
 */
@Data
@NoArgsConstructor
public class ApiServerConfig {

    public static final String PUBLIC_API_SERVER = "https://api.home-gallery.org";
    public static final String DOCUMENTATION_URL = "https://docs.home-gallery.org";

    private String url = PUBLIC_API_SERVER;

    /** Maximum number of in-flight requests per enricher. */
    private int concurrent = 5;

    /** Per-request timeout in seconds. */
    private int timeout = 30;

    /**
     * Feature keys to skip, e.g. {@code objectDetection}. A single value is accepted
     * in place of a list.
     */
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> disable = new ArrayList<>();

    /** Endpoint prefix that triggers the privacy warning. */
    private String publicUrl = PUBLIC_API_SERVER;

    private String documentationUrl = DOCUMENTATION_URL;

    public boolean isDisabled(String feature) {
        return disable != null && disable.contains(feature);
    }
}
