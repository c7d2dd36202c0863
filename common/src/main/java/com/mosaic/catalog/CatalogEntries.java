package com.mosaic.catalog;

import com.mosaic.index.FileIndex;
import com.mosaic.index.IndexEntry;
import com.mosaic.model.Entry;
import com.mosaic.model.EntryType;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Derives catalog entries from a file index.
 *
 * <p>Only file records with a checksum become entries. Files with identical content share
 * one entry; the first record in index order wins.</p>
 */
public final class CatalogEntries {

    private CatalogEntries() {
        // utility class
    }

    public static Stream<Entry> fromIndex(FileIndex index) {
        Set<String> seen = new HashSet<>();
        return index.getData().stream()
                .filter(IndexEntry::isFile)
                .filter(record -> record.getSha1sum() != null && !record.getSha1sum().isBlank())
                .filter(record -> seen.add(record.getSha1sum()))
                .map(CatalogEntries::toEntry);
    }

    static Entry toEntry(IndexEntry record) {
        return Entry.builder()
                .id(record.getSha1sum())
                .type(EntryType.fromFilename(record.getFilename()))
                .filename(record.getFilename())
                .build();
    }
}
