package com.cloudcost.attribution.domain.model;

/**
 * Workload identity facet a cost record was tag-matched against.
 *
 * The qualifier is appended to the matched tag so that an alias or label match
 * can be told apart from a direct identity match in output data.
 */
public enum MatchKind {
    CLUSTER("Cluster", ""),
    CLUSTER_ALIAS("ClusterAlias", " (alias)"),
    NODE("Node", ""),
    NAMESPACE("Namespace", ""),
    POD_LABEL("PodLabel", " (pod_labels)"),
    VOLUME_LABEL("VolumeLabel", " (volume_labels)");

    private final String displayName;
    private final String qualifier;

    MatchKind(String displayName, String qualifier) {
        this.displayName = displayName;
        this.qualifier = qualifier;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getQualifier() {
        return qualifier;
    }

    /**
     * Format the matched tag, e.g. {@code openshift_cluster=prod (alias)}.
     */
    public String describe(String tagKey, String tagValue) {
        return tagKey + "=" + tagValue + qualifier;
    }
}
