package com.cloudcost.attribution.streaming;

import java.util.Locale;

/**
 * Configured {@code use-streaming} value.
 */
public enum StreamingPreference {
    TRUE,
    FALSE,
    AUTO;

    /**
     * Parse a configuration value. Anything other than true/false means auto-detection.
     */
    public static StreamingPreference parse(String value) {
        if (value == null) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> TRUE;
            case "false" -> FALSE;
            default -> AUTO;
        };
    }
}
