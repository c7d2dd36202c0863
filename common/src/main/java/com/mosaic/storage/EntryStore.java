package com.mosaic.storage;

import com.mosaic.model.Entry;

import java.io.IOException;

/**
 * Artifact storage for catalog entries.
 *
 * <p>Every derived file of an entry (preview images, enrichment results) is addressed
 * by the entry and a logical suffix such as {@code image-preview-800.jpg} or
 * {@code objects.json}. Implementations must tolerate concurrent reads and writes
 * on different entries; no ordering across entries is required.</p>
 */
public interface EntryStore {

    /**
     * Returns {@code true} if the artifact exists for the entry.
     */
    boolean hasEntryFile(Entry entry, String suffix);

    /**
     * Reads the artifact bytes.
     *
     * @throws IOException if the artifact is missing or cannot be read
     */
    byte[] readEntryFile(Entry entry, String suffix) throws IOException;

    /**
     * Writes (or replaces) the artifact.
     *
     * @throws IOException if the artifact cannot be written
     */
    void writeEntryFile(Entry entry, String suffix, byte[] data) throws IOException;
}
