package com.mosaic.config;

import com.mosaic.pipeline.ExtractorPipeline;
import com.mosaic.storage.EntryStore;
import com.mosaic.storage.FileEntryStore;
import com.mosaic.testutil.InMemoryEntryStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MosaicPipelineAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(MosaicPipelineAutoConfiguration.class);

    @Test
    void bindsPropertiesAndCreatesFileStore() {
        runner.withPropertyValues(
                        "mosaic.storage.dir=/tmp/mosaic-storage",
                        "mosaic.extractor.api-server.url=http://localhost:3000",
                        "mosaic.extractor.api-server.disable=objectDetection,faceDetection",
                        "mosaic.extractor.image-preview-sizes=800,320")
                .run(context -> {
                    PipelineConfig config = context.getBean(PipelineConfig.class);
                    assertThat(config.getApiServer().getUrl()).isEqualTo("http://localhost:3000");
                    assertThat(config.getApiServer().getDisable()).containsExactly("objectDetection", "faceDetection");
                    assertThat(config.getImagePreviewSizes()).containsExactly(800, 320);

                    assertThat(context).hasSingleBean(ExtractorPipeline.class);
                    assertThat(context.getBean(EntryStore.class)).isInstanceOf(FileEntryStore.class);
                    assertThat(((FileEntryStore) context.getBean(EntryStore.class)).getStorageDir())
                            .isEqualTo(Path.of("/tmp/mosaic-storage"));
                });
    }

    @Test
    void backsOffForCustomStore() {
        runner.withBean(EntryStore.class, InMemoryEntryStore::new)
                .run(context -> assertThat(context.getBean(EntryStore.class)).isInstanceOf(InMemoryEntryStore.class));
    }
}
