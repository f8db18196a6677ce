package com.cloudcost.attribution.domain.model;

/**
 * Which workload-side identifier a cost record's resource id matched by suffix.
 */
public enum ResourceMatchType {
    NODE("node"),
    PERSISTENT_VOLUME("pv"),
    CSI_HANDLE("csi_handle");

    private final String label;

    ResourceMatchType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
