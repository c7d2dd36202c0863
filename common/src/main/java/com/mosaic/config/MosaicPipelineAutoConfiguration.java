package com.mosaic.config;

import com.mosaic.pipeline.ExtractorPipeline;
import com.mosaic.storage.EntryStore;
import com.mosaic.storage.FileEntryStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration that wires the pipeline beans.
 *
 * <p>Discovered via component-scanning from a {@code @SpringBootApplication} that scans
 * {@code com.mosaic.*}. An application may provide its own {@link EntryStore} bean, for
 * example one backed by a different storage layout.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class MosaicPipelineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EntryStore entryStore(PipelineConfig config) {
        return new FileEntryStore(Path.of(config.getStorage().getDir()));
    }

    @Bean
    public ExtractorPipeline extractorPipeline(PipelineConfig config, EntryStore entryStore) {
        return new ExtractorPipeline(config, entryStore);
    }
}
