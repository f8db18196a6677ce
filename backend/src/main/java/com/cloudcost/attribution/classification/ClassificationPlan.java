package com.cloudcost.attribution.classification;

import com.cloudcost.attribution.domain.model.DisabledRule;

import java.util.List;

/**
 * Which classification rules a batch's schema allows.
 *
 * @param networkDetection         product code and product family are declared
 * @param savingsPlanNormalization line item type is declared
 * @param disabledRules            rules switched off, for reporting
 */
public record ClassificationPlan(
        boolean networkDetection,
        boolean savingsPlanNormalization,
        List<DisabledRule> disabledRules
) {

    public ClassificationPlan {
        disabledRules = List.copyOf(disabledRules);
    }

    public static ClassificationPlan all() {
        return new ClassificationPlan(true, true, List.of());
    }
}
