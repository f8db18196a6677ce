package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.CostField;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DisabledRule;
import com.cloudcost.attribution.domain.model.MatchKind;
import com.cloudcost.attribution.tagging.EnabledTagKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Tag-based matching of cost records to workload identities.
 *
 * PRIORITY ORDER (first satisfied rule wins):
 * 1. openshift_cluster tag in cluster ids       -> CLUSTER
 * 2. openshift_cluster tag in cluster aliases   -> CLUSTER_ALIAS
 * 3. openshift_node tag in node names           -> NODE
 * 4. openshift_project tag in namespaces        -> NAMESPACE
 * 5. first other tag pair found in pod labels    -> POD_LABEL
 * 6. first other tag pair found in volume labels -> VOLUME_LABEL
 *
 * Rules 1-4 come from iterating {@link SpecialTag}; rules 5-6 walk the record's
 * remaining tags in stored order. The tag map is filtered by the enabled tag keys
 * first.
 *
 * Records already matched by resource id or by a previous tag match are returned
 * untouched, so matching happens at most once per record. An unmatched record is
 * a normal outcome; its cost ends up unattributed downstream.
 */
@Service
@Slf4j
public class MatchEngine {

    static final String TAG_MATCHING_RULE = "tag-matching";

    private static final Map<MatchKind, Function<WorkloadIdentityIndex, Set<String>>> FACETS =
            new EnumMap<>(MatchKind.class);

    static {
        FACETS.put(MatchKind.CLUSTER, WorkloadIdentityIndex::getClusterIds);
        FACETS.put(MatchKind.CLUSTER_ALIAS, WorkloadIdentityIndex::getClusterAliases);
        FACETS.put(MatchKind.NODE, WorkloadIdentityIndex::getNodeNames);
        FACETS.put(MatchKind.NAMESPACE, WorkloadIdentityIndex::getNamespaces);
        FACETS.put(MatchKind.POD_LABEL, WorkloadIdentityIndex::getPodLabelPairs);
        FACETS.put(MatchKind.VOLUME_LABEL, WorkloadIdentityIndex::getVolumeLabelPairs);
    }

    private static final List<MatchKind> LABEL_KINDS = List.of(MatchKind.POD_LABEL, MatchKind.VOLUME_LABEL);

    /**
     * Tag matching needs the resource tags; without them it is disabled for the batch.
     */
    public Optional<DisabledRule> checkSchema(Set<CostField> schema) {
        if (schema.contains(CostField.RESOURCE_TAGS)) {
            return Optional.empty();
        }
        DisabledRule rule = new DisabledRule(TAG_MATCHING_RULE, Set.of(CostField.RESOURCE_TAGS));
        log.warn("Tag matching: {}", rule.describe());
        return Optional.of(rule);
    }

    public CostRecord match(CostRecord record, WorkloadIdentityIndex index, EnabledTagKeys enabledTagKeys) {
        if (record.isResourceMatched() || record.isTagMatched()) {
            return record;
        }

        Map<String, String> tags = record.hasConsolidatedTags() ? record.getConsolidatedTags() : Map.of();
        Optional<IdentityMatch> match = findMatch(enabledTagKeys.filter(tags), index);
        if (match.isEmpty()) {
            return record;
        }

        IdentityMatch identity = match.get();
        log.debug("Matched cost record {} by tag: {}", record.getResourceIdentifier(), identity.matchedTag());
        return record.toBuilder()
                .tagMatched(true)
                .matchedTag(identity.matchedTag())
                .matchedIdentityKind(identity.kind())
                .matchedIdentityValue(identity.value())
                .build();
    }

    /**
     * Evaluate the priority rules against an already filtered tag map.
     */
    public Optional<IdentityMatch> findMatch(Map<String, String> tags, WorkloadIdentityIndex index) {
        if (tags.isEmpty()) {
            return Optional.empty();
        }

        for (SpecialTag specialTag : SpecialTag.values()) {
            String value = tags.get(specialTag.getKey());
            if (value == null) {
                continue;
            }
            for (MatchKind kind : specialTag.getKinds()) {
                if (FACETS.get(kind).apply(index).contains(value)) {
                    return Optional.of(new IdentityMatch(kind, value, kind.describe(specialTag.getKey(), value)));
                }
            }
        }

        for (MatchKind kind : LABEL_KINDS) {
            Set<String> labelPairs = FACETS.get(kind).apply(index);
            if (labelPairs.isEmpty()) {
                continue;
            }
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                if (SpecialTag.isSpecial(tag.getKey())) {
                    continue;
                }
                String pair = WorkloadIdentityIndex.labelPair(tag.getKey(), tag.getValue());
                if (labelPairs.contains(pair)) {
                    return Optional.of(new IdentityMatch(kind, pair, kind.describe(tag.getKey(), tag.getValue())));
                }
            }
        }

        return Optional.empty();
    }
}
