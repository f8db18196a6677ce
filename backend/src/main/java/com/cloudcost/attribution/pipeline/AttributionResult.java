package com.cloudcost.attribution.pipeline;

import com.cloudcost.attribution.classification.NetworkCostPartition;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DisabledRule;
import com.cloudcost.attribution.matching.MatchStatistics;
import com.cloudcost.attribution.matching.QualityWarning;
import com.cloudcost.attribution.streaming.StreamingDecision;

import java.util.List;

/**
 * Outcome of one attribution run.
 *
 * @param records           augmented records, in input order; only completed chunks when cancelled
 * @param statistics        match counters over {@code records}
 * @param qualityWarning    set when the combined match rate is below the configured minimum, else null
 * @param disabledRules     rules skipped for the whole batch because of missing columns
 * @param streamingDecision execution mode used
 * @param chunksProcessed   number of chunks completed
 * @param cancelled         whether the run stopped early on request
 */
public record AttributionResult(
        List<CostRecord> records,
        MatchStatistics statistics,
        QualityWarning qualityWarning,
        List<DisabledRule> disabledRules,
        StreamingDecision streamingDecision,
        int chunksProcessed,
        boolean cancelled
) {

    public AttributionResult {
        records = List.copyOf(records);
        disabledRules = List.copyOf(disabledRules);
    }

    public boolean hasQualityWarning() {
        return qualityWarning != null;
    }

    /**
     * Split the records for downstream attribution: network cost goes to nodes only.
     */
    public NetworkCostPartition partitionNetworkCost() {
        return NetworkCostPartition.of(records);
    }
}
