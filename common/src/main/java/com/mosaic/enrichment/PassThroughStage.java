package com.mosaic.enrichment;

import com.mosaic.model.Entry;

import java.util.stream.Stream;

/**
 * Identity stage used for disabled features and log-only steps. Performs no I/O.
 */
public final class PassThroughStage implements EntryStage {

    private final String description;

    public PassThroughStage(String description) {
        this.description = description;
    }

    @Override
    public Stream<Entry> apply(Stream<Entry> entries) {
        return entries;
    }

    @Override
    public String toString() {
        return "PassThroughStage[" + description + "]";
    }
}
