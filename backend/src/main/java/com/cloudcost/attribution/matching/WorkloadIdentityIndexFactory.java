package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.WorkloadRecord;
import com.cloudcost.attribution.tagging.TagPayloadParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the {@link WorkloadIdentityIndex} in a single pass over the workload data.
 *
 * Cluster ids come from the data itself (multi-cluster runs). When no row carries
 * a cluster id the run-level id is used instead. Label payloads that fail to parse
 * contribute nothing and are counted, never thrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkloadIdentityIndexFactory {

    private final TagPayloadParser payloadParser;

    public WorkloadIdentityIndex build(Collection<WorkloadRecord> workloads) {
        return build(null, null, workloads);
    }

    /**
     * @param clusterId    run-level cluster id, used when rows carry none
     * @param clusterAlias run-level cluster alias, may be null
     * @param workloads    pod and storage usage rows
     */
    public WorkloadIdentityIndex build(String clusterId, String clusterAlias, Collection<WorkloadRecord> workloads) {
        Set<String> clusterIds = distinct(workloads, WorkloadRecord::clusterId);
        if (clusterIds.isEmpty() && hasText(clusterId)) {
            clusterIds.add(clusterId);
            log.info("No cluster id in workload data, using run cluster id {}", clusterId);
        }

        Set<String> clusterAliases = distinct(workloads, WorkloadRecord::clusterAlias);
        if (hasText(clusterAlias)) {
            clusterAliases.add(clusterAlias);
        }

        LabelCollector podLabels = new LabelCollector();
        LabelCollector volumeLabels = new LabelCollector();
        for (WorkloadRecord workload : workloads) {
            podLabels.add(workload.podLabels());
            volumeLabels.add(workload.volumeLabels());
            volumeLabels.add(workload.volumeClaimLabels());
        }

        WorkloadIdentityIndex index = WorkloadIdentityIndex.builder()
                .clusterIds(clusterIds)
                .clusterAliases(clusterAliases)
                .nodeNames(distinct(workloads, WorkloadRecord::node))
                .namespaces(distinct(workloads, WorkloadRecord::namespace))
                .podLabelPairs(podLabels.pairs)
                .volumeLabelPairs(volumeLabels.pairs)
                .nodeResourceIds(distinct(workloads, WorkloadRecord::nodeResourceId))
                .persistentVolumeNames(distinct(workloads, WorkloadRecord::persistentVolume))
                .csiVolumeHandles(distinct(workloads, WorkloadRecord::csiVolumeHandle))
                .labelParseFailures(podLabels.failures + volumeLabels.failures)
                .build();

        log.info("Built workload identity index from {} rows: {} ({} values)",
                workloads.size(), index, index.totalValues());
        if (index.getLabelParseFailures() > 0) {
            log.warn("{} workload label payloads could not be parsed and were ignored",
                    index.getLabelParseFailures());
        }
        return index;
    }

    private static Set<String> distinct(Collection<WorkloadRecord> workloads, Function<WorkloadRecord, String> field) {
        Set<String> values = new LinkedHashSet<>();
        for (WorkloadRecord workload : workloads) {
            String value = field.apply(workload);
            if (hasText(value)) {
                values.add(value);
            }
        }
        return values;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Accumulates "key=value" pairs; identical payloads are parsed once.
     */
    private final class LabelCollector {
        private final Set<String> pairs = new LinkedHashSet<>();
        private final Set<String> seenPayloads = new LinkedHashSet<>();
        private long failures;

        void add(String payload) {
            if (!hasText(payload) || !seenPayloads.add(payload)) {
                return;
            }
            Optional<Map<String, String>> labels = payloadParser.parseLabels(payload);
            if (labels.isEmpty()) {
                failures++;
                return;
            }
            labels.get().forEach((key, value) -> pairs.add(WorkloadIdentityIndex.labelPair(key, value)));
        }
    }
}
