package com.mosaic;

import com.mosaic.catalog.CatalogEntries;
import com.mosaic.config.PipelineConfig;
import com.mosaic.index.FileIndex;
import com.mosaic.index.FileIndexReader;
import com.mosaic.pipeline.ExtractorPipeline;
import com.mosaic.storage.FileEntryStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Abstract base for enrichment jobs.
 *
 * <p>Subclasses only need to provide the default config resource name and
 * the job display name. The pipeline is fully generic and is driven
 * by the YAML configuration.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class ExtractorJob extends EnrichmentJobBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       protected String getJobName(PipelineConfig c) { return "Extractor"; }
 *       public static void main(String[] args) throws Exception { new ExtractorJob().run(args); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class EnrichmentJobBase {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    /**
     * Display name used in log lines.
     */
    protected abstract String getJobName(PipelineConfig config);

    /**
     * Runs the enrichment pipeline end-to-end.
     *
     * @param args optional single argument: path to a YAML config file
     * @return the number of processed entries
     */
    public long run(String[] args) throws Exception {
        // ── Load configuration ───────────────────────────────────────────
        PipelineConfig config;
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            config = PipelineConfig.load(args[0]);
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = PipelineConfig.loadFromClasspath(resource);
        }
        return run(config);
    }

    public long run(PipelineConfig config) throws Exception {
        log.info("Starting {}", getJobName(config));
        log.info("Enrichers configured: {}", config.getEnrichers().size());

        // ── Read catalog ─────────────────────────────────────────────────
        Path indexFile = Path.of(config.getIndex().getFile());
        FileIndex index = new FileIndexReader().read(indexFile);
        log.info("Read {} index records from {}", index.getData().size(), indexFile);

        // ── Build and execute pipeline ───────────────────────────────────
        FileEntryStore store = new FileEntryStore(Path.of(config.getStorage().getDir()));
        ExtractorPipeline pipeline = new ExtractorPipeline(config, store);
        return pipeline.run(CatalogEntries.fromIndex(index));
    }
}
