package com.cloudcost.attribution.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One AWS Cost and Usage Report line item as seen by the attribution engine.
 *
 * DESIGN RATIONALE:
 * Records are immutable. Every stage (tag consolidation, cost classification,
 * resource-id matching, tag matching) is a function from one record to a new
 * record built with {@link #toBuilder()}. This keeps the per-record work free of
 * shared state so chunks can be processed on a worker pool.
 *
 * FIELD OWNERSHIP:
 * - Input fields come from the parsed CUR row.
 * - Derived fields (consolidated tags, direction, amortized cost, match flags)
 *   are written by exactly one stage each.
 *
 * A record is never both resource-matched and tag-matched.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString(exclude = "rawTagColumns")
public class CostRecord {

    /**
     * Provider-assigned resource id, e.g. {@code i-0123456789abcdef0} or an EBS volume id.
     * Null for line items without a resource (taxes, support fees).
     */
    private final String resourceIdentifier;

    private final String productCode;

    private final String usageType;

    private final String operation;

    private final String productFamily;

    /**
     * CUR line item type: Usage, Tax, DiscountedUsage, SavingsPlanCoveredUsage, ...
     */
    private final String lineItemType;

    @Builder.Default
    private final BigDecimal unblendedCost = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal blendedCost = BigDecimal.ZERO;

    /**
     * Savings plan effective cost. Null when the column is absent for the row.
     */
    private final BigDecimal savingsPlanEffectiveCost;

    private final BigDecimal usageAmount;

    private final Instant usageStart;

    /**
     * Sparse tag columns as read from the report, e.g. {@code resourceTags/user:app}
     * or direct columns such as {@code openshift_cluster}. Values may be null.
     * Emptied once tags are consolidated.
     */
    @Builder.Default
    private final Map<String, String> rawTagColumns = Map.of();

    /**
     * Serialized JSON tag object for rows whose tags arrive already consolidated.
     */
    private final String tagPayload;

    // Derived fields

    private final Map<String, String> consolidatedTags;

    private final boolean tagParseFailed;

    private final DataTransferDirection dataTransferDirection;

    private final BigDecimal amortizedCost;

    private final boolean resourceMatched;

    private final String matchedResourceId;

    private final ResourceMatchType resourceMatchType;

    private final boolean tagMatched;

    /**
     * Human-readable form of the tag that matched, e.g. {@code openshift_node=worker-1}.
     */
    private final String matchedTag;

    private final MatchKind matchedIdentityKind;

    private final String matchedIdentityValue;

    public boolean isNetworkCost() {
        return dataTransferDirection != null;
    }

    /**
     * Matched by either the resource-id shortcut or a tag rule.
     */
    public boolean isAttributed() {
        return resourceMatched || tagMatched;
    }

    public boolean hasConsolidatedTags() {
        return consolidatedTags != null;
    }
}
