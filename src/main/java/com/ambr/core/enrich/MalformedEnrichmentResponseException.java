package com.ambr.core.enrich;

import java.io.IOException;

/**
 * The enrichment service answered, but not in the expected shape. Not retried.
 */
public class MalformedEnrichmentResponseException extends IOException {

    public MalformedEnrichmentResponseException(String message) {
        super(message);
    }

    public MalformedEnrichmentResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
