package com.mosaic.pipeline;

import com.mosaic.config.EnricherConfig;
import com.mosaic.config.PipelineConfig;
import com.mosaic.enrichment.ApiServerPrivacyHint;
import com.mosaic.enrichment.EnricherFactory;
import com.mosaic.enrichment.EntryStage;
import com.mosaic.model.Entry;
import com.mosaic.storage.EntryStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Chains the configured enrichers over the catalog entry stream.
 *
 * <p>Pipeline per run:
 * <pre>
 *   [entries]
 *       → api server privacy hint   (pass-through)
 *       → enricher 1 .. n           (bounded dispatcher or pass-through when disabled)
 *       → drained and counted
 * </pre>
 *
 * <p>Each enricher works independently: a failing inference feature trips only its own
 * error budget while the other features keep running.</p>
 */
@Slf4j
public class ExtractorPipeline {

    private final PipelineConfig config;
    private final EntryStore store;

    public ExtractorPipeline(PipelineConfig config, EntryStore store) {
        this.config = config;
        this.store = store;
    }

    /**
     * Builds fresh stages for one run, in configured enricher order.
     */
    public List<EntryStage> buildStages() {
        List<EntryStage> stages = new ArrayList<>();
        stages.add(ApiServerPrivacyHint.create(config.getApiServer()));
        for (EnricherConfig enricherConfig : config.getEnrichers()) {
            stages.add(EnricherFactory.create(enricherConfig).createStage(store, config));
        }
        log.debug("Built {} stages: {}", stages.size(), stages);
        return stages;
    }

    /**
     * Runs all stages over the given entries and waits until every entry passed the last
     * stage.
     *
     * @return the number of entries that left the pipeline
     */
    public long run(Stream<Entry> entries) {
        Stream<Entry> stream = entries;
        for (EntryStage stage : buildStages()) {
            stream = stage.apply(stream);
        }
        try (Stream<Entry> processed = stream) {
            long count = processed.reduce(0L, (n, entry) -> n + 1, Long::sum);
            log.info("Processed {} entries", count);
            return count;
        }
    }
}
