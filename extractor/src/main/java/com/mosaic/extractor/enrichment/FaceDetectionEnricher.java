package com.mosaic.extractor.enrichment;

import com.mosaic.enrichment.ApiServerEnricher;

/**
 * Detects faces, with their landmarks and descriptors, in an image.
 */
public class FaceDetectionEnricher extends ApiServerEnricher {

    public static final String FEATURE = "faceDetection";
    public static final String ENTRY_SUFFIX = "faces.json";

    @Override
    public String getFeature() {
        return FEATURE;
    }

    @Override
    public String getDisplayName() {
        return "face detection";
    }

    @Override
    public String getApiPath() {
        return "/faces";
    }

    @Override
    public String getEntrySuffix() {
        return ENTRY_SUFFIX;
    }
}
