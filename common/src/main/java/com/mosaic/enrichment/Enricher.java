package com.mosaic.enrichment;

import com.mosaic.config.PipelineConfig;
import com.mosaic.storage.EntryStore;

/**
 * Contract for all enrichment features.
 *
 * <p>An enricher is a configuration binder: it inspects the pipeline configuration and
 * contributes one {@link EntryStage} to the extractor pipeline. Implementations are
 * created reflectively by {@link EnricherFactory} and therefore need a public no-args
 * constructor.</p>
 *
 * <p>Features that are switched off return a {@link PassThroughStage} rather than being
 * left out, so the pipeline shape does not depend on configuration.</p>
 */
public interface Enricher {

    /**
     * Builds the stage for one pipeline run. Every call returns a fresh stage with its own
     * error budget and worker pool.
     */
    EntryStage createStage(EntryStore store, PipelineConfig config);
}
