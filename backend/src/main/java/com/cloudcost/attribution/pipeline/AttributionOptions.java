package com.cloudcost.attribution.pipeline;

import com.cloudcost.attribution.tagging.EnabledTagKeys;
import lombok.Builder;
import lombok.Getter;

import java.util.function.BooleanSupplier;

/**
 * Per-run overrides for {@link AttributionPipeline}.
 */
@Getter
@Builder
public class AttributionOptions {

    /**
     * Streaming override; null defers to configuration and auto-detection.
     */
    private final Boolean forceStreaming;

    /**
     * Run resource-id matching ahead of tag matching.
     */
    @Builder.Default
    private final boolean applyResourceIdMatching = true;

    /**
     * Tag keys used for matching; null falls back to {@code attribution.enabled-tag-keys}.
     */
    private final EnabledTagKeys enabledTagKeys;

    /**
     * Polled between chunks; returning true stops the run after the current chunk.
     */
    @Builder.Default
    private final BooleanSupplier cancellation = () -> false;

    public static AttributionOptions defaults() {
        return AttributionOptions.builder().build();
    }
}
