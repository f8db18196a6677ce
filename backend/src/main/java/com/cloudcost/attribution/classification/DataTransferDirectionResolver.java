package com.cloudcost.attribution.classification;

import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DataTransferDirection;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives the transfer direction of EC2 data transfer line items.
 *
 * A record is network cost when its product code is {@code AmazonEC2} and its
 * product family is {@code Data Transfer}. Direction comes from the usage type,
 * and for regional transfer from the operation:
 *
 * <pre>
 *   usage type contains "in-bytes"                              -> IN
 *   usage type contains "out-bytes"                             -> OUT
 *   usage type contains "regional-bytes", operation has "-in"   -> IN
 *   usage type contains "regional-bytes", operation has "-out"  -> OUT
 * </pre>
 *
 * Matching is case-insensitive and the first rule that applies wins.
 */
@Component
public class DataTransferDirectionResolver {

    static final String NETWORK_PRODUCT_CODE = "AmazonEC2";
    static final String NETWORK_PRODUCT_FAMILY = "Data Transfer";

    private static final List<DirectionRule> RULES = List.of(
            new DirectionRule("in-bytes", null, DataTransferDirection.IN),
            new DirectionRule("out-bytes", null, DataTransferDirection.OUT),
            new DirectionRule("regional-bytes", "-in", DataTransferDirection.IN),
            new DirectionRule("regional-bytes", "-out", DataTransferDirection.OUT)
    );

    public boolean isNetworkRecord(CostRecord record) {
        return NETWORK_PRODUCT_CODE.equals(record.getProductCode())
                && NETWORK_PRODUCT_FAMILY.equals(record.getProductFamily());
    }

    /**
     * Direction for a network record; empty for non-network or unrecognized usage.
     */
    public Optional<DataTransferDirection> resolve(CostRecord record) {
        if (!isNetworkRecord(record) || record.getUsageType() == null) {
            return Optional.empty();
        }
        String usageType = record.getUsageType().toLowerCase(Locale.ROOT);
        String operation = record.getOperation() == null ? "" : record.getOperation().toLowerCase(Locale.ROOT);

        return RULES.stream()
                .filter(rule -> rule.matches(usageType, operation))
                .map(DirectionRule::direction)
                .findFirst();
    }

    private record DirectionRule(String usageMarker, String operationMarker, DataTransferDirection direction) {

        boolean matches(String usageType, String operation) {
            return usageType.contains(usageMarker)
                    && (operationMarker == null || operation.contains(operationMarker));
        }
    }
}
