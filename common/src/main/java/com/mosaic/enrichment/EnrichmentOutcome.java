package com.mosaic.enrichment;

/**
 * How a single {@link EnrichmentTask} run ended.
 */
public enum EnrichmentOutcome {

    /** Response stored under the output suffix. */
    ENRICHED,

    /** The preview could not be read from the entry store. */
    READ_FAILED,

    /** The API could not be reached or timed out. */
    TRANSPORT_FAILED,

    /** The API answered with a status outside [100, 300). */
    HTTP_FAILED,

    /** The response could not be written to the entry store. */
    WRITE_FAILED,

    /** The worker was interrupted while waiting for the API. */
    INTERRUPTED,

    /** The task threw an unexpected runtime exception. */
    UNEXPECTED_ERROR
}
