package com.mosaic.storage;

import com.mosaic.model.Entry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link EntryStore} backed by a local directory tree.
 *
 * <p>Artifacts live at {@code {storageDir}/{id[0,2]}/{id[2,4]}/{id[4..]}-{suffix}}, which
 * spreads entries over two directory levels. Writes go to a temporary sibling file that
 * is then moved into place, so readers never observe a partially written artifact.</p>
 */
@Slf4j
public class FileEntryStore implements EntryStore {

    private final Path storageDir;

    public FileEntryStore(Path storageDir) {
        this.storageDir = storageDir.toAbsolutePath().normalize();
        log.debug("Using entry storage directory {}", this.storageDir);
    }

    public Path getStorageDir() {
        return storageDir;
    }

    @Override
    public boolean hasEntryFile(Entry entry, String suffix) {
        return Files.isRegularFile(resolve(entry, suffix));
    }

    @Override
    public byte[] readEntryFile(Entry entry, String suffix) throws IOException {
        return Files.readAllBytes(resolve(entry, suffix));
    }

    @Override
    public void writeEntryFile(Entry entry, String suffix, byte[] data) throws IOException {
        Path target = resolve(entry, suffix);
        Files.createDirectories(target.getParent());

        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Resolves the artifact path of an entry. Ids shorter than five characters are
     * stored without the directory fan-out.
     */
    Path resolve(Entry entry, String suffix) {
        String id = entry.getId();
        if (id.length() < 5) {
            return storageDir.resolve(id + "-" + suffix);
        }
        return storageDir
                .resolve(id.substring(0, 2))
                .resolve(id.substring(2, 4))
                .resolve(id.substring(4) + "-" + suffix);
    }
}
