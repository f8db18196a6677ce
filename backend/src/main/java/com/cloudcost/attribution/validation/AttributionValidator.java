package com.cloudcost.attribution.validation;

import com.cloudcost.attribution.domain.model.CostBatch;
import com.cloudcost.attribution.domain.model.CostField;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.matching.MatchStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Strict checks a caller can run before or after attribution.
 *
 * The pipeline itself never fails a batch for missing columns or a low match rate;
 * it degrades and reports. Callers that need a hard failure use these checks.
 */
@Component
@Slf4j
public class AttributionValidator {

    public void requireFields(CostBatch batch, Set<CostField> required) {
        EnumSet<CostField> missing = EnumSet.noneOf(CostField.class);
        for (CostField field : required) {
            if (!batch.declares(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            log.error("Cost batch is missing required columns: {}", missing);
            throw new SchemaValidationException(missing);
        }
    }

    public void requireMinimumMatchRate(MatchStatistics statistics, double minimumRate) {
        if (statistics.totalRecords() == 0) {
            return;
        }
        if (statistics.combinedMatchRate() < minimumRate) {
            throw new MatchRateValidationException(statistics.combinedMatchRate(), minimumRate);
        }
    }

    /**
     * A record may be attributed by resource id or by tag, never both.
     */
    public void requireExclusiveMatchFlags(List<CostRecord> records) {
        long conflicting = records.stream()
                .filter(record -> record.isResourceMatched() && record.isTagMatched())
                .count();
        if (conflicting > 0) {
            throw new AttributionValidationException(
                    conflicting + " records are flagged as both resource-matched and tag-matched");
        }
    }
}
