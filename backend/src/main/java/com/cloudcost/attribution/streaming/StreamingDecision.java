package com.cloudcost.attribution.streaming;

import java.util.List;

/**
 * Execution mode chosen for a run.
 *
 * @param streaming whether records are processed in bounded chunks
 * @param chunkSize records per chunk; the whole batch when not streaming
 * @param source    what decided: override, configuration or auto-detection
 * @param reasons   human-readable signals that led to the decision
 */
public record StreamingDecision(boolean streaming, int chunkSize, Source source, List<String> reasons) {

    public StreamingDecision {
        reasons = List.copyOf(reasons);
    }

    public enum Source {
        OVERRIDE,
        CONFIGURATION,
        AUTO_DETECTED
    }
}
