package com.mosaic.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes a {@link FileIndex} as gzip-compressed JSON.
 *
 * <p>Records are sorted by directory descending, then by filename ascending. In dry-run
 * mode the index is built and returned but nothing is written.</p>
 */
@Slf4j
public class FileIndexWriter {

    public static final String INDEX_TYPE = "mosaic/fileindex@1.0";

    static final Comparator<IndexEntry> BY_DIR_DESC_FILE_ASC =
            Comparator.comparing(IndexEntry::directory, Comparator.reverseOrder())
                    .thenComparing(IndexEntry::getFilename, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileIndexWriter() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public FileIndexWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public FileIndex write(Path directory, Path file, List<IndexEntry> entries, boolean dryRun) throws IOException {
        List<IndexEntry> sorted = new ArrayList<>(entries);
        sorted.sort(BY_DIR_DESC_FILE_ASC);

        FileIndex index = new FileIndex(
                INDEX_TYPE,
                Instant.now(clock).toString(),
                directory.toAbsolutePath().normalize().toString(),
                sorted);

        if (dryRun) {
            log.info("Dry run: skip writing index {} with {} entries", file, sorted.size());
            return index;
        }

        Path target = file.toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp))) {
                objectMapper.writeValue(out, index);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Wrote index {} with {} entries", target, sorted.size());
        return index;
    }
}
