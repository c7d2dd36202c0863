package com.mosaic.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code mosaic.*} prefix.  The static
 * {@link #load(String)} and {@link #loadFromClasspath(String)} helpers read the same
 * kebab-case YAML for standalone / test usage outside the Spring context.</p>
 */
@Data
@ConfigurationProperties(prefix = "mosaic")
public class PipelineConfig {

    private static final String ROOT_KEY = "mosaic";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StorageSection storage = new StorageSection();
    private IndexSection index = new IndexSection();
    private ExtractorSection extractor = new ExtractorSection();
    private List<EnricherConfig> enrichers = new ArrayList<>();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return fromTree(YAML_MAPPER.readTree(new File(path)));
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return fromTree(YAML_MAPPER.readTree(is));
        }
    }

    private static PipelineConfig fromTree(JsonNode root) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new PipelineConfig();
        }
        JsonNode node = root.has(ROOT_KEY) ? root.get(ROOT_KEY) : root;
        return YAML_MAPPER.treeToValue(node, PipelineConfig.class);
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public ApiServerConfig getApiServer() {
        return extractor.getApiServer();
    }

    public List<Integer> getImagePreviewSizes() {
        return extractor.getImagePreviewSizes();
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class StorageSection {
        private String dir = "./storage";
    }

    @Data
    public static class IndexSection {
        private String file = "./files.idx";
    }

    @Data
    public static class ExtractorSection {
        private List<Integer> imagePreviewSizes = new ArrayList<>(List.of(1920, 1280, 800, 320, 128));
        private ApiServerConfig apiServer = new ApiServerConfig();
    }
}
