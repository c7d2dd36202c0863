package com.mosaic.extractor;

import com.mosaic.EnrichmentJobBase;
import com.mosaic.config.PipelineConfig;

/**
 * Entry point for the extractor job: sends image previews of all catalog entries to the
 * inference API and stores similarity embeddings, objects and faces next to each entry.
 *
 * <p>Usage:
 * <pre>
 *   java -jar mosaic-extractor.jar [config-path]
 * </pre>
 *
 * <p>If no config path is supplied, the default classpath resource
 * {@code pipeline-config.yaml} is used.</p>
 */
public class ExtractorJob extends EnrichmentJobBase {

    private static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName(PipelineConfig config) {
        return "Mosaic Extractor [" + config.getApiServer().getUrl() + "]";
    }

    public static void main(String[] args) throws Exception {
        new ExtractorJob().run(args);
    }
}
