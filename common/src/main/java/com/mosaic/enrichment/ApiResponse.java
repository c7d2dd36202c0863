package com.mosaic.enrichment;

import lombok.Value;

/**
 * Raw answer of the inference API.
 */
@Value
public class ApiResponse {

    int statusCode;
    byte[] body;

    public boolean isSuccessful() {
        return statusCode >= 100 && statusCode < 300;
    }
}
