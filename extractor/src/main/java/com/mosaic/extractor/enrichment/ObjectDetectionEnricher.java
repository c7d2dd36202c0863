package com.mosaic.extractor.enrichment;

import com.mosaic.enrichment.ApiServerEnricher;

/**
 * Detects objects in an image.
 *
 * <h3>Response stored as {@code objects.json} (example)</h3>
 * <pre>{@code
 * {
 *   "width": 800,
 *   "height": 600,
 *   "data": [
 *     { "class": "person", "score": 0.91, "bbox": [120, 40, 200, 380] }
 *   ]
 * }
 * }</pre>
 */
public class ObjectDetectionEnricher extends ApiServerEnricher {

    public static final String FEATURE = "objectDetection";
    public static final String ENTRY_SUFFIX = "objects.json";

    @Override
    public String getFeature() {
        return FEATURE;
    }

    @Override
    public String getDisplayName() {
        return "object detection";
    }

    @Override
    public String getApiPath() {
        return "/objects";
    }

    @Override
    public String getEntrySuffix() {
        return ENTRY_SUFFIX;
    }
}
