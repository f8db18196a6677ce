package com.cloudcost.attribution.matching;

import java.util.Optional;

/**
 * Non-fatal signal that too few cost records could be attributed.
 *
 * A low combined match rate is expected when AWS resources are not tagged for
 * OpenShift; it never invalidates the records that did match.
 */
public record QualityWarning(double combinedMatchRate, double minimumRate, String message) {

    public static Optional<QualityWarning> evaluate(MatchStatistics statistics, double minimumRate) {
        if (statistics.totalRecords() == 0 || statistics.combinedMatchRate() >= minimumRate) {
            return Optional.empty();
        }
        String message = String.format(
                "Low combined match rate: %.2f%% (minimum %.2f%%); some AWS resources may not have OpenShift tags",
                statistics.combinedMatchRate() * 100, minimumRate * 100);
        return Optional.of(new QualityWarning(statistics.combinedMatchRate(), minimumRate, message));
    }
}
