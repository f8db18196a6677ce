package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.MatchKind;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OpenShift tags with a dedicated matching rule, in priority order.
 *
 * Declaration order is the matching order: the engine iterates {@link #values()}
 * and, for each tag, the identity kinds it can match in their listed order.
 */
public enum SpecialTag {
    CLUSTER("openshift_cluster", MatchKind.CLUSTER, MatchKind.CLUSTER_ALIAS),
    NODE("openshift_node", MatchKind.NODE),
    NAMESPACE("openshift_project", MatchKind.NAMESPACE);

    private static final Set<String> KEYS = Arrays.stream(values())
            .map(SpecialTag::getKey)
            .collect(Collectors.toUnmodifiableSet());

    private final String key;
    private final List<MatchKind> kinds;

    SpecialTag(String key, MatchKind... kinds) {
        this.key = key;
        this.kinds = List.of(kinds);
    }

    public String getKey() {
        return key;
    }

    public List<MatchKind> getKinds() {
        return kinds;
    }

    public static boolean isSpecial(String tagKey) {
        return KEYS.contains(tagKey);
    }
}
