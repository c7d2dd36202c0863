package com.mosaic.testutil;

import com.mosaic.model.Entry;
import com.mosaic.storage.EntryStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed entry store with switchable read/write failures per suffix.
 */
public class InMemoryEntryStore implements EntryStore {

    private final Map<String, byte[]> files = new ConcurrentHashMap<>();
    private final Set<String> failingReads = ConcurrentHashMap.newKeySet();
    private final Set<String> failingWrites = ConcurrentHashMap.newKeySet();
    private final AtomicInteger writes = new AtomicInteger();

    public InMemoryEntryStore put(Entry entry, String suffix, String content) {
        files.put(key(entry, suffix), content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public InMemoryEntryStore failReads(String suffix) {
        failingReads.add(suffix);
        return this;
    }

    public InMemoryEntryStore failWrites(String suffix) {
        failingWrites.add(suffix);
        return this;
    }

    public String content(Entry entry, String suffix) {
        byte[] data = files.get(key(entry, suffix));
        return data == null ? null : new String(data, StandardCharsets.UTF_8);
    }

    public int getWrites() {
        return writes.get();
    }

    @Override
    public boolean hasEntryFile(Entry entry, String suffix) {
        return files.containsKey(key(entry, suffix));
    }

    @Override
    public byte[] readEntryFile(Entry entry, String suffix) throws IOException {
        if (failingReads.contains(suffix)) {
            throw new IOException("Simulated read failure of " + suffix);
        }
        byte[] data = files.get(key(entry, suffix));
        if (data == null) {
            throw new IOException("No such entry file " + key(entry, suffix));
        }
        return data;
    }

    @Override
    public void writeEntryFile(Entry entry, String suffix, byte[] data) throws IOException {
        if (failingWrites.contains(suffix)) {
            throw new IOException("Simulated write failure of " + suffix);
        }
        files.put(key(entry, suffix), data);
        writes.incrementAndGet();
    }

    private static String key(Entry entry, String suffix) {
        return entry.getId() + "-" + suffix;
    }
}
