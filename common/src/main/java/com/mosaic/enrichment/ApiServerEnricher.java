package com.mosaic.enrichment;

import com.mosaic.config.ApiServerConfig;
import com.mosaic.config.EnrichmentConfig;
import com.mosaic.config.PipelineConfig;
import com.mosaic.storage.EntryStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class of enrichers that send an image preview to the inference API and store its
 * JSON answer next to the entry.
 *
 * <h3>How to implement a feature</h3>
 * <ol>
 *   <li>Return the configuration key used in {@code api-server.disable} from
 *       {@link #getFeature()}.</li>
 *   <li>Return the API path (e.g. {@code /objects}) and the suffix the response is stored
 *       under (e.g. {@code objects.json}).</li>
 * </ol>
 * Everything else (preview selection, eligibility, error budget, concurrency) is shared.
 *
 * <p>Only previews up to {@link #MAX_PREVIEW_SIZE} pixels are sent; the configured preview
 * sizes are kept in their configured order, which is also the order of preference.</p>
 */
@Slf4j
public abstract class ApiServerEnricher implements Enricher {

    public static final int MAX_PREVIEW_SIZE = 800;

    /** Key of this feature in {@code api-server.disable}, e.g. {@code objectDetection}. */
    public abstract String getFeature();

    /** Name used in log lines, e.g. {@code object detection}. */
    public abstract String getDisplayName();

    public abstract String getApiPath();

    public abstract String getEntrySuffix();

    @Override
    public EntryStage createStage(EntryStore store, PipelineConfig config) {
        ApiServerConfig apiServer = config.getApiServer();
        if (apiServer.isDisabled(getFeature())) {
            log.info("Disable {}", getDisplayName());
            return new PassThroughStage(getDisplayName() + " disabled");
        }
        if (previewSuffixes(config.getImagePreviewSizes()).isEmpty()) {
            log.warn("No image preview size up to {} configured. Skip {}", MAX_PREVIEW_SIZE, getDisplayName());
            return new PassThroughStage(getDisplayName() + " without previews");
        }

        EnrichmentConfig enrichmentConfig = buildEnrichmentConfig(config);
        ApiServerClient client = new ApiServerClient(Duration.ofSeconds(enrichmentConfig.getTimeout()));
        return createDispatcher(store, client, enrichmentConfig);
    }

    /**
     * Binds the shared api-server settings to this feature.
     */
    public EnrichmentConfig buildEnrichmentConfig(PipelineConfig config) {
        ApiServerConfig apiServer = config.getApiServer();
        return EnrichmentConfig.builder()
                .name(getDisplayName())
                .apiServerUrl(apiServer.getUrl())
                .apiPath(getApiPath())
                .imagePreviewSuffixes(previewSuffixes(config.getImagePreviewSizes()))
                .entrySuffix(getEntrySuffix())
                .concurrent(apiServer.getConcurrent())
                .timeout(apiServer.getTimeout())
                .build();
    }

    /**
     * Wires eligibility check, task and a fresh error budget into one dispatcher.
     */
    public static BoundedDispatcher createDispatcher(EntryStore store, ApiServerClient client,
                                                     EnrichmentConfig config) {
        ErrorBudget errorBudget = new ErrorBudget(config.getName());
        EnrichmentEligibility eligibility = new EnrichmentEligibility(store, config, errorBudget);
        EnrichmentTask task = new EnrichmentTask(store, client, config, errorBudget);
        return new BoundedDispatcher(config.getName(), eligibility, task::run, config.getConcurrent());
    }

    static List<String> previewSuffixes(List<Integer> sizes) {
        return sizes.stream()
                .filter(size -> size != null && size <= MAX_PREVIEW_SIZE)
                .map(ImagePreviewSuffix::ofSize)
                .collect(Collectors.toList());
    }
}
