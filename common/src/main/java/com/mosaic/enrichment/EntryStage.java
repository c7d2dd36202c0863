package com.mosaic.enrichment;

import com.mosaic.model.Entry;

import java.util.stream.Stream;

/**
 * One step of the extractor pipeline. A stage receives the entry stream of the previous
 * stage and returns the stream for the next one; entries are passed on unchanged.
 */
@FunctionalInterface
public interface EntryStage {

    Stream<Entry> apply(Stream<Entry> entries);

    default EntryStage andThen(EntryStage next) {
        return entries -> next.apply(apply(entries));
    }
}
