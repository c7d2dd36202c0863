package com.mosaic.extractor.enrichment;

import com.mosaic.enrichment.ApiServerEnricher;

/**
 * Fetches the similarity embedding vector of an image, used to find visually similar
 * entries.
 */
public class SimilarityEmbeddingsEnricher extends ApiServerEnricher {

    public static final String FEATURE = "similarDetection";
    public static final String ENTRY_SUFFIX = "similarity-embeddings.json";

    @Override
    public String getFeature() {
        return FEATURE;
    }

    @Override
    public String getDisplayName() {
        return "similarity embeddings";
    }

    @Override
    public String getApiPath() {
        return "/embeddings";
    }

    @Override
    public String getEntrySuffix() {
        return ENTRY_SUFFIX;
    }
}
