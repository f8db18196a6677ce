package com.cloudcost.attribution.domain.model;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * A rule switched off for a whole batch because its input fields are not part of
 * the batch schema.
 */
public record DisabledRule(String rule, Set<CostField> missingFields) {

    public DisabledRule {
        missingFields = Set.copyOf(missingFields);
    }

    public String describe() {
        return rule + " disabled, missing columns: " + missingFields.stream()
                .map(CostField::getColumnName)
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
