package com.cloudcost.attribution.pipeline;

/**
 * Infrastructure failure while processing a batch: a worker threw or the calling
 * thread was interrupted. Never raised for a single malformed record.
 */
public class AttributionProcessingException extends RuntimeException {

    public AttributionProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
