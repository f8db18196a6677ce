package com.cloudcost.attribution.classification;

import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DataTransferDirection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classified records split into network (direction set) and regular cost.
 *
 * Network cost is attributed to nodes only, never to namespaces, so downstream
 * attribution handles the two lists separately.
 */
public record NetworkCostPartition(List<CostRecord> networkRecords, List<CostRecord> regularRecords) {

    public static NetworkCostPartition of(List<CostRecord> records) {
        List<CostRecord> network = new ArrayList<>();
        List<CostRecord> regular = new ArrayList<>();
        for (CostRecord record : records) {
            (record.isNetworkCost() ? network : regular).add(record);
        }
        return new NetworkCostPartition(List.copyOf(network), List.copyOf(regular));
    }

    public Map<DataTransferDirection, Long> countByDirection() {
        Map<DataTransferDirection, Long> counts = new EnumMap<>(DataTransferDirection.class);
        for (CostRecord record : networkRecords) {
            counts.merge(record.getDataTransferDirection(), 1L, Long::sum);
        }
        return counts;
    }
}
