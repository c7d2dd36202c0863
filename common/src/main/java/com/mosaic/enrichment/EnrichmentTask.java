package com.mosaic.enrichment;

import com.mosaic.config.EnrichmentConfig;
import com.mosaic.model.Entry;
import com.mosaic.storage.EntryStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Enriches one entry: reads its preview, posts it to the inference API and stores the
 * response body verbatim under the configured output suffix.
 *
 * <p>{@link #run(Entry)} never throws. Every failure ends the task for this entry only:
 * <ul>
 *   <li>local read/write failures are logged and leave the {@link ErrorBudget} untouched,</li>
 *   <li>transport failures and non-success status codes count against the budget,</li>
 *   <li>a stored response gives one error back to the budget.</li>
 * </ul>
 */
@Slf4j
public class EnrichmentTask {

    private final EntryStore store;
    private final ApiServerClient client;
    private final EnrichmentConfig config;
    private final ErrorBudget errorBudget;

    public EnrichmentTask(EntryStore store, ApiServerClient client,
                          EnrichmentConfig config, ErrorBudget errorBudget) {
        this.store = store;
        this.client = client;
        this.config = config;
        this.errorBudget = errorBudget;
    }

    public EnrichmentOutcome run(Entry entry) {
        long t0 = System.currentTimeMillis();
        String name = config.getName();

        // ── Read preview ─────────────────────────────────────────────────
        Optional<String> previewSuffix = EnrichmentEligibility.findPreviewSuffix(
                store, entry, config.getImagePreviewSuffixes());
        if (previewSuffix.isEmpty()) {
            log.warn("No image preview of {} found. Skip {} for this entry", entry, name);
            return EnrichmentOutcome.READ_FAILED;
        }
        String suffix = previewSuffix.get();

        byte[] preview;
        try {
            preview = store.readEntryFile(entry, suffix);
        } catch (IOException e) {
            log.warn("Could not read image entry file {} from {}: {}. Skip {} for this entry",
                    suffix, entry, e.getMessage(), name);
            return EnrichmentOutcome.READ_FAILED;
        }

        // ── Call API ─────────────────────────────────────────────────────
        String url = config.getUrl();
        ApiResponse response;
        try {
            response = client.post(url, ImagePreviewSuffix.contentType(suffix), preview,
                    Duration.ofSeconds(config.getTimeout()));
        } catch (IOException e) {
            errorBudget.recordFailure();
            log.warn("Could not get {} of {} from URL {}: {}", name, entry, url, e.toString());
            return EnrichmentOutcome.TRANSPORT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching {} of {} from URL {}", name, entry, url);
            return EnrichmentOutcome.INTERRUPTED;
        }

        if (!response.isSuccessful()) {
            errorBudget.recordFailure();
            log.error("Could not get {} of {} from URL {}: HTTP response code is {}",
                    name, entry, url, response.getStatusCode());
            return EnrichmentOutcome.HTTP_FAILED;
        }

        // ── Store response ───────────────────────────────────────────────
        try {
            store.writeEntryFile(entry, config.getEntrySuffix(), response.getBody());
        } catch (IOException e) {
            log.warn("Could not write {} of {}: {}", name, entry, e.getMessage());
            return EnrichmentOutcome.WRITE_FAILED;
        }

        errorBudget.recordSuccess();
        log.debug("Fetched {} for {} in {}ms", name, entry, System.currentTimeMillis() - t0);
        return EnrichmentOutcome.ENRICHED;
    }
}
