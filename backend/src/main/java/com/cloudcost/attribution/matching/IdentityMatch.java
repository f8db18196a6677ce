package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.MatchKind;

/**
 * Outcome of a successful tag match.
 *
 * @param kind       identity facet that matched
 * @param value      matched identity value; "key=value" for label matches
 * @param matchedTag display form, including the kind's qualifier
 */
public record IdentityMatch(MatchKind kind, String value, String matchedTag) {}
