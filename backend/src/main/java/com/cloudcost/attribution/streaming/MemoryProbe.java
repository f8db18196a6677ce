package com.cloudcost.attribution.streaming;

import java.util.OptionalDouble;

/**
 * Live memory telemetry for the streaming decision.
 */
public interface MemoryProbe {

    /**
     * Memory currently available to new allocations, in GB. Empty when it cannot be measured.
     */
    OptionalDouble availableMemoryGb();
}
