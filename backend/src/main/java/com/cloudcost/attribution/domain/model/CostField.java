package com.cloudcost.attribution.domain.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Input fields of a cost record, keyed by their CUR column names.
 *
 * A batch declares which fields its source schema actually carries. Rules whose
 * preconditions name a field missing from that declaration are disabled for the
 * whole batch instead of failing row by row.
 */
public enum CostField {
    RESOURCE_IDENTIFIER("lineitem_resourceid"),
    PRODUCT_CODE("lineitem_productcode"),
    USAGE_TYPE("lineitem_usagetype"),
    OPERATION("lineitem_operation"),
    PRODUCT_FAMILY("product_productfamily"),
    LINE_ITEM_TYPE("lineitem_lineitemtype"),
    UNBLENDED_COST("lineitem_unblendedcost"),
    BLENDED_COST("lineitem_blendedcost"),
    SAVINGS_PLAN_EFFECTIVE_COST("savingsplan_savingsplaneffectivecost"),
    USAGE_AMOUNT("lineitem_usageamount"),
    USAGE_START("lineitem_usagestartdate"),
    RESOURCE_TAGS("resourcetags");

    private final String columnName;

    CostField(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }

    /**
     * Derive a schema from raw column names. The consolidated {@code resourcetags}
     * column, or any column accepted by {@code tagColumn}, declares {@link #RESOURCE_TAGS}.
     */
    public static Set<CostField> fromColumns(Collection<String> columns, Predicate<String> tagColumn) {
        EnumSet<CostField> fields = EnumSet.noneOf(CostField.class);
        for (String column : columns) {
            for (CostField field : values()) {
                if (field.columnName.equalsIgnoreCase(column)) {
                    fields.add(field);
                }
            }
            if (tagColumn.test(column)) {
                fields.add(RESOURCE_TAGS);
            }
        }
        return fields;
    }
}
