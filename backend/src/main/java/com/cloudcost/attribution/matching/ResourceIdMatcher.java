package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.ResourceMatchType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Exact attribution by resource id, ahead of tag matching.
 *
 * MATCHING:
 * - EC2 instance -> node: resource id ends with the node's instance id
 * - EBS volume -> PV: resource id ends with the persistent volume name
 * - EBS volume -> CSI: resource id ends with the CSI volume handle
 *
 * Suffix comparison mirrors {@code substr(resource_id, -length(id)) = id}. The
 * first facet that matches wins, in the order above.
 */
@Component
@Slf4j
public class ResourceIdMatcher {

    public CostRecord match(CostRecord record, WorkloadIdentityIndex index) {
        if (record.isResourceMatched() || record.isTagMatched()) {
            return record;
        }
        String resourceId = record.getResourceIdentifier();
        if (resourceId == null || resourceId.isEmpty()) {
            return record;
        }

        Optional<String> matched = suffixMatch(resourceId, index.getNodeResourceIds());
        ResourceMatchType type = ResourceMatchType.NODE;
        if (matched.isEmpty()) {
            matched = suffixMatch(resourceId, index.getPersistentVolumeNames());
            type = ResourceMatchType.PERSISTENT_VOLUME;
        }
        if (matched.isEmpty()) {
            matched = suffixMatch(resourceId, index.getCsiVolumeHandles());
            type = ResourceMatchType.CSI_HANDLE;
        }
        if (matched.isEmpty()) {
            return record;
        }

        log.debug("Matched resource {} to {} {}", resourceId, type.getLabel(), matched.get());
        return record.toBuilder()
                .resourceMatched(true)
                .matchedResourceId(matched.get())
                .resourceMatchType(type)
                .build();
    }

    private static Optional<String> suffixMatch(String resourceId, Set<String> candidates) {
        for (String candidate : candidates) {
            if (!candidate.isEmpty() && resourceId.endsWith(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
