package com.cloudcost.attribution.tagging;

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Columns such as {@code resourceTags/user:app}: the tag name is the column name
 * with the prefix removed. Columns are visited in the raw map's order.
 */
public class PrefixedTagSource implements TagSource {

    private final String prefix;

    public PrefixedTagSource(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Iterator<Map.Entry<String, String>> tags(Map<String, String> rawColumns) {
        return rawColumns.entrySet().stream()
                .filter(column -> claims(column.getKey()))
                .map(column -> (Map.Entry<String, String>) new AbstractMap.SimpleImmutableEntry<>(
                        column.getKey().substring(prefix.length()),
                        column.getValue()))
                .iterator();
    }

    @Override
    public boolean claims(String columnName) {
        return columnName.startsWith(prefix) && columnName.length() > prefix.length();
    }
}
