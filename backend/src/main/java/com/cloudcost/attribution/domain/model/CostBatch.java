package com.cloudcost.attribution.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Records handed to the engine together with the schema they were read with.
 */
public record CostBatch(Set<CostField> schema, List<CostRecord> records) {

    public CostBatch {
        schema = schema.isEmpty() ? EnumSet.noneOf(CostField.class) : EnumSet.copyOf(schema);
        records = List.copyOf(records);
    }

    /**
     * Batch whose source carried every known field.
     */
    public static CostBatch of(List<CostRecord> records) {
        return new CostBatch(EnumSet.allOf(CostField.class), records);
    }

    public boolean declares(CostField field) {
        return schema.contains(field);
    }

    public int size() {
        return records.size();
    }
}
