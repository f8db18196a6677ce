package com.cloudcost.attribution.matching;

import lombok.Builder;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read-only snapshot of the workload identities known for one processing run.
 *
 * LIFECYCLE:
 * Built once from the OpenShift usage data by {@link WorkloadIdentityIndexFactory}
 * before any matching starts, then shared by all workers. Every facet is an
 * unmodifiable, insertion-ordered set; a facet without data is empty.
 *
 * Label facets hold {@code "key=value"} strings.
 */
@Getter
public final class WorkloadIdentityIndex {

    private static final WorkloadIdentityIndex EMPTY = WorkloadIdentityIndex.builder().build();

    private final Set<String> clusterIds;
    private final Set<String> clusterAliases;
    private final Set<String> nodeNames;
    private final Set<String> namespaces;
    private final Set<String> podLabelPairs;
    private final Set<String> volumeLabelPairs;

    private final Set<String> nodeResourceIds;
    private final Set<String> persistentVolumeNames;
    private final Set<String> csiVolumeHandles;

    /**
     * Label payloads that could not be parsed while building the index.
     */
    private final long labelParseFailures;

    @Builder
    private WorkloadIdentityIndex(
            Collection<String> clusterIds,
            Collection<String> clusterAliases,
            Collection<String> nodeNames,
            Collection<String> namespaces,
            Collection<String> podLabelPairs,
            Collection<String> volumeLabelPairs,
            Collection<String> nodeResourceIds,
            Collection<String> persistentVolumeNames,
            Collection<String> csiVolumeHandles,
            long labelParseFailures
    ) {
        this.clusterIds = freeze(clusterIds);
        this.clusterAliases = freeze(clusterAliases);
        this.nodeNames = freeze(nodeNames);
        this.namespaces = freeze(namespaces);
        this.podLabelPairs = freeze(podLabelPairs);
        this.volumeLabelPairs = freeze(volumeLabelPairs);
        this.nodeResourceIds = freeze(nodeResourceIds);
        this.persistentVolumeNames = freeze(persistentVolumeNames);
        this.csiVolumeHandles = freeze(csiVolumeHandles);
        this.labelParseFailures = labelParseFailures;
    }

    public static WorkloadIdentityIndex empty() {
        return EMPTY;
    }

    public static String labelPair(String key, String value) {
        return key + "=" + value;
    }

    public int totalValues() {
        return clusterIds.size() + clusterAliases.size() + nodeNames.size() + namespaces.size()
                + podLabelPairs.size() + volumeLabelPairs.size();
    }

    private static Set<String> freeze(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    @Override
    public String toString() {
        return "WorkloadIdentityIndex{clusters=" + clusterIds.size()
                + ", aliases=" + clusterAliases.size()
                + ", nodes=" + nodeNames.size()
                + ", namespaces=" + namespaces.size()
                + ", podLabels=" + podLabelPairs.size()
                + ", volumeLabels=" + volumeLabelPairs.size() + "}";
    }
}
