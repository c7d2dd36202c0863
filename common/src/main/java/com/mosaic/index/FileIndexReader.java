package com.mosaic.index;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Reads a gzip-compressed JSON {@link FileIndex} written by {@link FileIndexWriter}.
 */
@Slf4j
public class FileIndexReader {

    private static final String TYPE_PREFIX = "mosaic/fileindex@1.";

    private final ObjectMapper objectMapper;

    public FileIndexReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public FileIndexReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FileIndex read(Path file) throws IOException {
        FileIndex index;
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            index = objectMapper.readValue(in, FileIndex.class);
        }
        if (index.getType() == null || !index.getType().startsWith(TYPE_PREFIX)) {
            throw new IOException("Unsupported index type " + index.getType() + " in " + file);
        }
        log.debug("Read index {} with {} entries", file, index.getData().size());
        return index;
    }
}
