package com.cloudcost.attribution.tagging;

import java.util.Iterator;
import java.util.Map;

/**
 * Adapter over one column naming scheme that yields tag key/value pairs.
 *
 * Each implementation decides which raw columns it owns and how a column name
 * maps to a tag key. Sources never filter values; empty and null values are
 * dropped by {@link TagConsolidator}.
 */
public interface TagSource {

    /**
     * Tag entries contributed by this source, keyed by tag name.
     */
    Iterator<Map.Entry<String, String>> tags(Map<String, String> rawColumns);

    /**
     * Whether the given raw column belongs to this naming scheme.
     */
    boolean claims(String columnName);
}
