package com.cloudcost.attribution.tagging;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tag keys an operator has enabled for cost attribution.
 *
 * An empty set means no restriction: every consolidated tag is considered.
 */
public record EnabledTagKeys(Set<String> keys) {

    private static final EnabledTagKeys UNRESTRICTED = new EnabledTagKeys(Set.of());

    public EnabledTagKeys {
        keys = keys == null ? Set.of() : Set.copyOf(keys);
    }

    public static EnabledTagKeys unrestricted() {
        return UNRESTRICTED;
    }

    public static EnabledTagKeys of(Collection<String> keys) {
        return keys == null || keys.isEmpty() ? UNRESTRICTED : new EnabledTagKeys(Set.copyOf(keys));
    }

    public boolean isRestricted() {
        return !keys.isEmpty();
    }

    /**
     * Keep only enabled keys, preserving the tags' iteration order.
     */
    public Map<String, String> filter(Map<String, String> tags) {
        if (!isRestricted() || tags.isEmpty()) {
            return tags;
        }
        Map<String, String> filtered = new LinkedHashMap<>();
        tags.forEach((key, value) -> {
            if (keys.contains(key)) {
                filtered.put(key, value);
            }
        });
        return Collections.unmodifiableMap(filtered);
    }
}
