package com.cloudcost.attribution.domain.model;

import lombok.Builder;

/**
 * One row of OpenShift usage data contributing to the workload identity index.
 *
 * Label fields hold either a JSON object ({@code {"app":"web"}}) or the pipe
 * format ({@code app:web|tier:frontend}). Any field may be null.
 *
 * @param clusterId          OpenShift cluster id
 * @param clusterAlias       cluster alias, at most one per run
 * @param node               node name
 * @param namespace          project / namespace
 * @param podLabels          pod label payload
 * @param volumeLabels       persistent volume label payload
 * @param volumeClaimLabels  persistent volume claim label payload
 * @param nodeResourceId     EC2 instance id backing the node
 * @param persistentVolume   persistent volume name
 * @param csiVolumeHandle    CSI volume handle, usually the EBS volume id
 */
@Builder
public record WorkloadRecord(
        String clusterId,
        String clusterAlias,
        String node,
        String namespace,
        String podLabels,
        String volumeLabels,
        String volumeClaimLabels,
        String nodeResourceId,
        String persistentVolume,
        String csiVolumeHandle
) {}
