package com.cloudcost.attribution.validation;

import lombok.Getter;

@Getter
public class MatchRateValidationException extends AttributionValidationException {

    private final double combinedMatchRate;
    private final double minimumRate;

    public MatchRateValidationException(double combinedMatchRate, double minimumRate) {
        super(String.format("Combined match rate %.2f%% is below the required %.2f%%",
                combinedMatchRate * 100, minimumRate * 100));
        this.combinedMatchRate = combinedMatchRate;
        this.minimumRate = minimumRate;
    }
}
