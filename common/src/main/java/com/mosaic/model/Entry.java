package com.mosaic.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One catalog item flowing through the enrichment pipeline.
 *
 * <p>Entries are immutable. Stages never transform them: enrichment results are
 * attached as artifacts through the {@link com.mosaic.storage.EntryStore}, and
 * the entry object itself is passed downstream as-is.</p>
 *
 * <p>The {@code id} is the content checksum of the source file and doubles as the
 * storage key of all derived artifacts.</p>
 */
@Value
@Builder
public class Entry {

    @NonNull
    String id;

    @NonNull
    EntryType type;

    /** Catalog-relative path of the source file. */
    String filename;

    @Override
    public String toString() {
        return id.length() > 7 ? id.substring(0, 7) : id;
    }
}
