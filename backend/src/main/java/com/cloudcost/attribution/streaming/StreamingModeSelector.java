package com.cloudcost.attribution.streaming;

import com.cloudcost.attribution.config.AttributionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Chooses between in-memory and chunked (streaming) processing.
 *
 * DECISION ORDER:
 * 1. Explicit caller override
 * 2. Explicit {@code use-streaming: true|false} configuration
 * 3. Auto-detection: stream when the estimated row count exceeds
 *    {@code threshold-rows} OR available memory is below {@code memory-threshold-gb}
 *
 * An unknown row count leaves only the memory signal; missing memory telemetry
 * leaves only the row count. With neither signal the batch runs in memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamingModeSelector {

    // Rough in-memory footprint of one cost record, used only for logging
    private static final long ESTIMATED_BYTES_PER_ROW = 60;

    private final AttributionProperties properties;
    private final MemoryProbe memoryProbe;

    /**
     * @param estimatedRows estimated record count, null when unknown
     * @param forceMode     caller override, null for none
     * @return true for streaming, false for in-memory
     */
    public boolean shouldStream(Long estimatedRows, Boolean forceMode) {
        return decide(estimatedRows, forceMode).streaming();
    }

    public StreamingDecision decide(Long estimatedRows, Boolean forceMode) {
        AttributionProperties.Streaming config = properties.getStreaming();

        if (forceMode != null) {
            log.info("Streaming mode forced: {}", modeName(forceMode));
            return decision(forceMode, estimatedRows, StreamingDecision.Source.OVERRIDE,
                    List.of("forced by caller"));
        }

        StreamingPreference preference = StreamingPreference.parse(config.getUseStreaming());
        if (preference != StreamingPreference.AUTO) {
            boolean streaming = preference == StreamingPreference.TRUE;
            log.info("Streaming mode set by configuration: {}", modeName(streaming));
            return decision(streaming, estimatedRows, StreamingDecision.Source.CONFIGURATION,
                    List.of("use-streaming=" + config.getUseStreaming()));
        }

        return autoDetect(estimatedRows, config);
    }

    private StreamingDecision autoDetect(Long estimatedRows, AttributionProperties.Streaming config) {
        List<String> reasons = new ArrayList<>();
        boolean streaming = false;

        if (estimatedRows != null) {
            if (estimatedRows > config.getThresholdRows()) {
                streaming = true;
                reasons.add(String.format("estimated %,d rows > %,d threshold", estimatedRows, config.getThresholdRows()));
            } else {
                reasons.add(String.format("estimated %,d rows <= %,d threshold", estimatedRows, config.getThresholdRows()));
            }
        } else {
            log.debug("Row count unknown, checking memory only");
        }

        OptionalDouble available = memoryProbe.availableMemoryGb();
        if (available.isPresent()) {
            double availableGb = available.getAsDouble();
            if (availableGb < config.getMemoryThresholdGb()) {
                streaming = true;
                reasons.add(String.format("available memory %.1f GB < %.1f GB threshold",
                        availableGb, config.getMemoryThresholdGb()));
                log.warn("Low memory detected ({} GB available, threshold {} GB), enabling streaming",
                        String.format("%.2f", availableGb), config.getMemoryThresholdGb());
            } else {
                reasons.add(String.format("available memory %.1f GB >= %.1f GB", availableGb,
                        config.getMemoryThresholdGb()));
            }
        } else {
            log.warn("Could not check system memory, deciding on row count only");
            reasons.add("memory check unavailable");
        }

        log.info("Auto-selected {} mode ({})", modeName(streaming), String.join("; ", reasons));
        return decision(streaming, estimatedRows, StreamingDecision.Source.AUTO_DETECTED, reasons);
    }

    private StreamingDecision decision(boolean streaming, Long estimatedRows,
                                       StreamingDecision.Source source, List<String> reasons) {
        int chunkSize = streaming ? properties.getStreaming().getChunkSize() : Integer.MAX_VALUE;
        StreamingDecision decision = new StreamingDecision(streaming, chunkSize, source, reasons);
        logDecision(decision, estimatedRows);
        return decision;
    }

    private void logDecision(StreamingDecision decision, Long estimatedRows) {
        if (decision.streaming()) {
            log.info("Streaming mode enabled: chunk_size={}, estimated_rows={}",
                    decision.chunkSize(), estimatedRows == null ? "unknown" : estimatedRows);
        } else if (estimatedRows != null) {
            long estimatedMb = estimatedRows * ESTIMATED_BYTES_PER_ROW / (1024 * 1024);
            log.info("In-memory mode enabled: estimated_rows={}, estimated_memory_mb=~{}", estimatedRows, estimatedMb);
        } else {
            log.info("In-memory mode enabled");
        }
    }

    private static String modeName(boolean streaming) {
        return streaming ? "streaming" : "in-memory";
    }
}
