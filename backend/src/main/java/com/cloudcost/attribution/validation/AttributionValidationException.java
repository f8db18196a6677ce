package com.cloudcost.attribution.validation;

/**
 * Raised when a caller-requested validation of attribution input or output fails.
 */
public class AttributionValidationException extends RuntimeException {

    public AttributionValidationException(String message) {
        super(message);
    }
}
