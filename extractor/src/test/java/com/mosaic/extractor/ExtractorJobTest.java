package com.mosaic.extractor;

import com.mosaic.config.PipelineConfig;
import com.mosaic.extractor.enrichment.FaceDetectionEnricher;
import com.mosaic.index.FileIndexWriter;
import com.mosaic.index.IndexEntry;
import com.mosaic.model.Entry;
import com.mosaic.model.EntryType;
import com.mosaic.storage.FileEntryStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractorJobTest {

    private static final String BEACH = "1a2b3c4d5e6f7a8b9c0d1a2b3c4d5e6f7a8b9c0d";
    private static final String DOG = "2b3c4d5e6f7a8b9c0d1a2b3c4d5e6f7a8b9c0d1a";
    private static final String CLIP = "3c4d5e6f7a8b9c0d1a2b3c4d5e6f7a8b9c0d1a2b";

    @TempDir
    Path tempDir;

    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::answer);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void loadsBundledConfiguration() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("pipeline-config.yaml");

        assertThat(config.getEnrichers()).hasSize(3);
        assertThat(config.getApiServer().getConcurrent()).isEqualTo(5);
        assertThat(config.getApiServer().getDisable()).isEmpty();
    }

    @Test
    void enrichesImagesOfTheCatalog() throws Exception {
        FileEntryStore store = prepareCatalog();
        PipelineConfig config = config();

        long processed = new ExtractorJob().run(config);

        assertThat(processed).isEqualTo(3);
        Entry beach = entry(BEACH, EntryType.IMAGE);
        assertThat(text(store, beach, "similarity-embeddings.json")).isEqualTo("{\"path\":\"/embeddings\"}");
        assertThat(text(store, beach, "objects.json")).isEqualTo("{\"path\":\"/objects\"}");
        assertThat(text(store, beach, "faces.json")).isEqualTo("{\"path\":\"/faces\"}");
        assertThat(store.hasEntryFile(entry(CLIP, EntryType.VIDEO), "objects.json")).isFalse();
        assertThat(paths).hasSize(6);
    }

    @Test
    void skipsDisabledFeatureAndEnrichedEntries() throws Exception {
        FileEntryStore store = prepareCatalog();
        Entry dog = entry(DOG, EntryType.IMAGE);
        store.writeEntryFile(dog, "objects.json", "{\"cached\":true}".getBytes(StandardCharsets.UTF_8));
        PipelineConfig config = config();
        config.getApiServer().setDisable(List.of(FaceDetectionEnricher.FEATURE));

        new ExtractorJob().run(config);

        assertThat(paths).doesNotContain("/faces").containsOnly("/embeddings", "/objects").hasSize(3);
        assertThat(text(store, dog, "objects.json")).isEqualTo("{\"cached\":true}");
        assertThat(store.hasEntryFile(dog, "faces.json")).isFalse();
    }

    @Test
    void readsConfigFileGivenOnCommandLine() throws Exception {
        prepareCatalog();
        Path configFile = tempDir.resolve("extractor.yaml");
        Files.writeString(configFile, String.join("\n",
                "mosaic:",
                "  storage:",
                "    dir: " + tempDir.resolve("storage"),
                "  index:",
                "    file: " + tempDir.resolve("files.idx"),
                "  extractor:",
                "    api-server:",
                "      url: " + url(),
                "      disable: similarDetection",
                "  enrichers:",
                "    - name: object-detection",
                "      class-name: com.mosaic.extractor.enrichment.ObjectDetectionEnricher",
                ""));

        long processed = new ExtractorJob().run(new String[]{configFile.toString()});

        assertThat(processed).isEqualTo(3);
        assertThat(paths).containsOnly("/objects").hasSize(2);
    }

    private FileEntryStore prepareCatalog() throws IOException {
        new FileIndexWriter().write(tempDir, tempDir.resolve("files.idx"), List.of(
                record("2023/beach.jpg", BEACH),
                record("2023/dog.jpg", DOG),
                record("2023/clip.mp4", CLIP),
                record("2023/copy-of-beach.jpg", BEACH)), false);

        FileEntryStore store = new FileEntryStore(tempDir.resolve("storage"));
        byte[] preview = "jpeg".getBytes(StandardCharsets.UTF_8);
        store.writeEntryFile(entry(BEACH, EntryType.IMAGE), "image-preview-320.jpg", preview);
        store.writeEntryFile(entry(DOG, EntryType.IMAGE), "image-preview-800.jpg", preview);
        store.writeEntryFile(entry(CLIP, EntryType.VIDEO), "image-preview-320.jpg", preview);
        return store;
    }

    private PipelineConfig config() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("pipeline-config.yaml");
        config.getStorage().setDir(tempDir.resolve("storage").toString());
        config.getIndex().setFile(tempDir.resolve("files.idx").toString());
        config.getApiServer().setUrl(url());
        config.getApiServer().setConcurrent(2);
        return config;
    }

    private String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private void answer(HttpExchange exchange) throws IOException {
        try {
            try (InputStream in = exchange.getRequestBody()) {
                in.readAllBytes();
            }
            String path = exchange.getRequestURI().getPath();
            paths.add(path);
            byte[] body = ("{\"path\":\"" + path + "\"}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        } finally {
            exchange.close();
        }
    }

    private static IndexEntry record(String filename, String sha1sum) {
        return IndexEntry.builder()
                .filename(filename)
                .size(2048)
                .sha1sum(sha1sum)
                .fileType(IndexEntry.FILE)
                .build();
    }

    private static Entry entry(String id, EntryType type) {
        return Entry.builder().id(id).type(type).filename(id + ".bin").build();
    }

    private static String text(FileEntryStore store, Entry entry, String suffix) throws IOException {
        return new String(store.readEntryFile(entry, suffix), StandardCharsets.UTF_8);
    }
}
