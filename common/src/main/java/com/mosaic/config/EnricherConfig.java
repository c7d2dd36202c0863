package com.mosaic.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for a single enricher instance.
 * The class must implement {@link com.mosaic.enrichment.Enricher} and have a no-args constructor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnricherConfig {

    private String name;
    private String className;
}
