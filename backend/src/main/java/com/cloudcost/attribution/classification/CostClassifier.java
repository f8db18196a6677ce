package com.cloudcost.attribution.classification;

import com.cloudcost.attribution.domain.model.CostField;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DisabledRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves cost fields whose meaning depends on context.
 *
 * Two independent rules run per record:
 * 1. Network direction detection ({@link DataTransferDirectionResolver})
 * 2. Savings plan normalization ({@link SavingsPlanNormalizer})
 *
 * Rule preconditions are checked once per batch against the declared schema via
 * {@link #plan(Set)}; a rule whose fields are missing is skipped for every record
 * and reported once. Classification only touches cost and direction fields, so it
 * may run before or after matching.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostClassifier {

    static final String NETWORK_DETECTION_RULE = "network-direction-detection";
    static final String SAVINGS_PLAN_RULE = "savings-plan-normalization";

    private final DataTransferDirectionResolver directionResolver;
    private final SavingsPlanNormalizer savingsPlanNormalizer;

    /**
     * Decide which rules can run for a batch with the given schema.
     */
    public ClassificationPlan plan(Set<CostField> schema) {
        List<DisabledRule> disabled = new ArrayList<>();

        Set<CostField> networkMissing = missing(schema, CostField.PRODUCT_CODE, CostField.PRODUCT_FAMILY);
        if (!networkMissing.isEmpty()) {
            disabled.add(new DisabledRule(NETWORK_DETECTION_RULE, networkMissing));
        }

        Set<CostField> savingsMissing = missing(schema, CostField.LINE_ITEM_TYPE);
        if (!savingsMissing.isEmpty()) {
            disabled.add(new DisabledRule(SAVINGS_PLAN_RULE, savingsMissing));
        }
        if (savingsMissing.isEmpty() && !schema.contains(CostField.SAVINGS_PLAN_EFFECTIVE_COST)) {
            log.info("Savings plan effective cost column not found, treating effective cost as 0");
        }

        disabled.forEach(rule -> log.warn("Cost classification: {}", rule.describe()));

        return new ClassificationPlan(networkMissing.isEmpty(), savingsMissing.isEmpty(), disabled);
    }

    public CostRecord classify(CostRecord record, ClassificationPlan plan) {
        CostRecord classified = record;

        if (plan.networkDetection() && classified.getDataTransferDirection() == null) {
            var direction = directionResolver.resolve(classified);
            if (direction.isPresent()) {
                classified = classified.toBuilder()
                        .dataTransferDirection(direction.get())
                        .build();
            }
        }

        if (plan.savingsPlanNormalization()) {
            classified = savingsPlanNormalizer.normalize(classified);
        }

        return classified;
    }

    public CostRecord classify(CostRecord record) {
        return classify(record, ClassificationPlan.all());
    }

    private static Set<CostField> missing(Set<CostField> schema, CostField... required) {
        EnumSet<CostField> missing = EnumSet.noneOf(CostField.class);
        for (CostField field : required) {
            if (!schema.contains(field)) {
                missing.add(field);
            }
        }
        return missing;
    }
}
