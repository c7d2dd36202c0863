package com.mosaic.enrichment;

import com.mosaic.config.ApiServerConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Tells the user where their previews are going before the first upload.
 */
@Slf4j
public final class ApiServerPrivacyHint {

    private ApiServerPrivacyHint() {
        // utility class
    }

    /**
     * Logs the hint and returns a stage that leaves the entry stream untouched.
     */
    public static EntryStage create(ApiServerConfig config) {
        String url = config.getUrl();
        String publicUrl = config.getPublicUrl();
        if (url != null && publicUrl != null && url.startsWith(publicUrl)) {
            log.warn("You are using the public api server {}. Please read its documentation at {} for privacy concerns",
                    url, config.getDocumentationUrl());
        } else {
            log.debug("Use api server {}", url);
        }
        log.trace("Use api server with {} concurrent connections and timeout of {}s",
                config.getConcurrent(), config.getTimeout());
        return new PassThroughStage("api server privacy hint");
    }
}
