package com.mosaic.pipeline;

import com.mosaic.config.EnricherConfig;
import com.mosaic.config.PipelineConfig;
import com.mosaic.enrichment.ApiServerEnricher;
import com.mosaic.enrichment.BoundedDispatcher;
import com.mosaic.enrichment.PassThroughStage;
import com.mosaic.model.Entry;
import com.mosaic.model.EntryType;
import com.mosaic.testutil.InMemoryEntryStore;
import com.mosaic.testutil.StubApiServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractorPipelineTest {

    private StubApiServer server;
    private InMemoryEntryStore store;
    private PipelineConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = StubApiServer.start().respond(200, "[]");
        store = new InMemoryEntryStore();
        config = new PipelineConfig();
        config.getApiServer().setUrl(server.url());
        config.getApiServer().setConcurrent(2);
        config.setEnrichers(List.of(
                new EnricherConfig("objects", ObjectsEnricher.class.getName()),
                new EnricherConfig("faces", FacesEnricher.class.getName())));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void buildsPrivacyHintFollowedByEnrichersInOrder() {
        config.getApiServer().setDisable(List.of("faceDetection"));

        List<?> stages = new ExtractorPipeline(config, store).buildStages();

        assertThat(stages).hasSize(3);
        assertThat(stages.get(0)).isInstanceOf(PassThroughStage.class);
        assertThat(stages.get(1)).isInstanceOf(BoundedDispatcher.class);
        assertThat(stages.get(2)).isInstanceOf(PassThroughStage.class);
    }

    @Test
    void runsEveryEnabledFeature() {
        List<Entry> entries = entries(6);

        long count = new ExtractorPipeline(config, store).run(entries.stream());

        assertThat(count).isEqualTo(6);
        assertThat(server.getRequests()).extracting(StubApiServer.Request::getPath)
                .containsOnly("/objects", "/faces")
                .hasSize(12);
        assertThat(entries).allMatch(e -> store.hasEntryFile(e, "objects.json") && store.hasEntryFile(e, "faces.json"));
    }

    @Test
    void disabledFeatureProducesNothing() {
        config.getApiServer().setDisable(List.of("faceDetection"));
        List<Entry> entries = entries(3);

        long count = new ExtractorPipeline(config, store).run(entries.stream());

        assertThat(count).isEqualTo(3);
        assertThat(server.getRequests()).extracting(StubApiServer.Request::getPath).containsOnly("/objects");
        assertThat(entries).noneMatch(e -> store.hasEntryFile(e, "faces.json"));
    }

    @Test
    void emptyCatalogFinishesImmediately() {
        assertThat(new ExtractorPipeline(config, store).run(Stream.empty())).isZero();
        assertThat(server.getRequestCount()).isZero();
    }

    private List<Entry> entries(int count) {
        List<Entry> entries = IntStream.range(0, count)
                .mapToObj(i -> Entry.builder()
                        .id(String.format("%040x", i + 1))
                        .type(EntryType.IMAGE)
                        .filename("photo" + i + ".jpg")
                        .build())
                .collect(Collectors.toList());
        entries.forEach(e -> store.put(e, "image-preview-800.jpg", "jpeg"));
        return entries;
    }

    public static class ObjectsEnricher extends ApiServerEnricher {
        @Override
        public String getFeature() {
            return "objectDetection";
        }

        @Override
        public String getDisplayName() {
            return "object detection";
        }

        @Override
        public String getApiPath() {
            return "/objects";
        }

        @Override
        public String getEntrySuffix() {
            return "objects.json";
        }
    }

    public static class FacesEnricher extends ApiServerEnricher {
        @Override
        public String getFeature() {
            return "faceDetection";
        }

        @Override
        public String getDisplayName() {
            return "face detection";
        }

        @Override
        public String getApiPath() {
            return "/faces";
        }

        @Override
        public String getEntrySuffix() {
            return "faces.json";
        }
    }
}
