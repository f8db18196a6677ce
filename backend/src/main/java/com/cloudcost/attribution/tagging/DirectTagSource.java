package com.cloudcost.attribution.tagging;

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Allow-listed columns that carry a tag value under the tag's own name, e.g.
 * {@code openshift_cluster}. Visited in allow-list order.
 */
public class DirectTagSource implements TagSource {

    private final Set<String> columns;

    public DirectTagSource(List<String> columns) {
        this.columns = new LinkedHashSet<>(columns);
    }

    @Override
    public Iterator<Map.Entry<String, String>> tags(Map<String, String> rawColumns) {
        return columns.stream()
                .filter(rawColumns::containsKey)
                .map(column -> (Map.Entry<String, String>) new AbstractMap.SimpleImmutableEntry<>(
                        column, rawColumns.get(column)))
                .iterator();
    }

    @Override
    public boolean claims(String columnName) {
        return columns.contains(columnName);
    }
}
