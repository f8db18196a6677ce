package com.cloudcost.attribution.classification;

import com.cloudcost.attribution.domain.model.CostRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Removes savings plan double counting and computes the amortized cost.
 *
 * COVERED USAGE:
 * AWS reports plan-covered usage twice: once as an informational
 * SavingsPlanCoveredUsage line and once on the plan's own charge line. The covered
 * line's unblended and blended costs are zeroed, but only when its effective cost
 * is strictly positive. A zero or missing effective cost means the line is not
 * really covered (generated data carries such defaults).
 *
 * AMORTIZED COST:
 * Tax and Usage lines amortize to their unblended cost; every other line type
 * amortizes to the savings plan effective cost, or zero when absent. A line without
 * a type counts as "every other".
 */
@Component
public class SavingsPlanNormalizer {

    static final String SAVINGS_PLAN_COVERED_USAGE = "SavingsPlanCoveredUsage";

    private static final Set<String> UNBLENDED_AMORTIZED_TYPES = Set.of("Tax", "Usage");

    public CostRecord normalize(CostRecord record) {
        BigDecimal effectiveCost = record.getSavingsPlanEffectiveCost();
        BigDecimal unblended = orZero(record.getUnblendedCost());
        BigDecimal blended = orZero(record.getBlendedCost());

        if (isCoveredUsage(record)) {
            unblended = BigDecimal.ZERO;
            blended = BigDecimal.ZERO;
        }

        String lineItemType = record.getLineItemType();
        BigDecimal amortized = lineItemType != null && UNBLENDED_AMORTIZED_TYPES.contains(lineItemType)
                ? unblended
                : orZero(effectiveCost);

        return record.toBuilder()
                .unblendedCost(unblended)
                .blendedCost(blended)
                .amortizedCost(amortized)
                .build();
    }

    /**
     * A covered-usage line whose headline costs must not be summed.
     */
    public boolean isCoveredUsage(CostRecord record) {
        BigDecimal effectiveCost = record.getSavingsPlanEffectiveCost();
        return SAVINGS_PLAN_COVERED_USAGE.equals(record.getLineItemType())
                && effectiveCost != null
                && effectiveCost.signum() > 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
