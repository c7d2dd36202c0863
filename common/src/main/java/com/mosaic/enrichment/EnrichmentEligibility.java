package com.mosaic.enrichment;

import com.mosaic.config.EnrichmentConfig;
import com.mosaic.model.Entry;
import com.mosaic.model.EntryType;
import com.mosaic.storage.EntryStore;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides whether an entry should be sent to the inference API.
 *
 * <p>An entry is eligible when the feature's {@link ErrorBudget} is not exhausted, one of
 * the preview suffixes exists, the output suffix does not exist yet and the entry is an
 * image or raw image. The check only reads state and may be called concurrently.</p>
 */
public class EnrichmentEligibility implements Predicate<Entry> {

    private static final Set<EntryType> SUPPORTED_TYPES = EnumSet.of(EntryType.IMAGE, EntryType.RAW_IMAGE);

    private final EntryStore store;
    private final EnrichmentConfig config;
    private final ErrorBudget errorBudget;

    public EnrichmentEligibility(EntryStore store, EnrichmentConfig config, ErrorBudget errorBudget) {
        this.store = store;
        this.config = config;
        this.errorBudget = errorBudget;
    }

    @Override
    public boolean test(Entry entry) {
        if (errorBudget.isExhausted()) {
            return false;
        } else if (findPreviewSuffix(store, entry, config.getImagePreviewSuffixes()).isEmpty()
                || store.hasEntryFile(entry, config.getEntrySuffix())) {
            return false;
        }
        return SUPPORTED_TYPES.contains(entry.getType());
    }

    /**
     * Returns the first suffix, in preference order, that exists for the entry.
     */
    static Optional<String> findPreviewSuffix(EntryStore store, Entry entry, List<String> suffixes) {
        return suffixes.stream()
                .filter(suffix -> store.hasEntryFile(entry, suffix))
                .findFirst();
    }
}
