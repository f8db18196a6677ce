package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.MatchKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collector;

/**
 * Match counters for a chunk or a whole run.
 *
 * Instances are immutable and combine with {@link #merge(MatchStatistics)}, which is
 * associative and commutative, so chunk results can be added in any order. Per-chunk
 * counting goes through a thread-confined {@link Accumulator} via {@link #collector()}.
 */
public record MatchStatistics(
        long totalRecords,
        long resourceMatched,
        long tagMatched,
        Map<MatchKind, Long> matchesByKind,
        long tagsFailedToParse,
        Map<String, Long> matchedByProduct
) {

    private static final MatchStatistics EMPTY =
            new MatchStatistics(0, 0, 0, Map.of(), 0, Map.of());

    public MatchStatistics {
        EnumMap<MatchKind, Long> kinds = new EnumMap<>(MatchKind.class);
        kinds.putAll(matchesByKind);
        matchesByKind = Collections.unmodifiableMap(kinds);
        matchedByProduct = Collections.unmodifiableMap(new TreeMap<>(matchedByProduct));
    }

    public static MatchStatistics empty() {
        return EMPTY;
    }

    public long combinedMatched() {
        return resourceMatched + tagMatched;
    }

    public long unmatched() {
        return totalRecords - combinedMatched();
    }

    /**
     * Fraction (0.0-1.0) of records attributed by resource id or tag. Zero for no records.
     */
    public double combinedMatchRate() {
        return totalRecords == 0 ? 0.0 : (double) combinedMatched() / totalRecords;
    }

    public long matchesOf(MatchKind kind) {
        return matchesByKind.getOrDefault(kind, 0L);
    }

    public MatchStatistics merge(MatchStatistics other) {
        Map<MatchKind, Long> kinds = new EnumMap<>(MatchKind.class);
        kinds.putAll(matchesByKind);
        other.matchesByKind.forEach((kind, count) -> kinds.merge(kind, count, Long::sum));

        Map<String, Long> products = new HashMap<>(matchedByProduct);
        other.matchedByProduct.forEach((product, count) -> products.merge(product, count, Long::sum));

        return new MatchStatistics(
                totalRecords + other.totalRecords,
                resourceMatched + other.resourceMatched,
                tagMatched + other.tagMatched,
                kinds,
                tagsFailedToParse + other.tagsFailedToParse,
                products
        );
    }

    public static Collector<CostRecord, Accumulator, MatchStatistics> collector() {
        return Collector.of(
                Accumulator::new,
                Accumulator::add,
                Accumulator::combine,
                Accumulator::toStatistics,
                Collector.Characteristics.UNORDERED
        );
    }

    /**
     * Mutable counters, confined to one thread until combined.
     */
    public static final class Accumulator {
        private long total;
        private long resourceMatched;
        private long tagMatched;
        private long tagsFailedToParse;
        private final Map<MatchKind, Long> kinds = new EnumMap<>(MatchKind.class);
        private final Map<String, Long> products = new HashMap<>();

        public void add(CostRecord record) {
            total++;
            if (record.isTagParseFailed()) {
                tagsFailedToParse++;
            }
            if (record.isResourceMatched()) {
                resourceMatched++;
            } else if (record.isTagMatched()) {
                tagMatched++;
                if (record.getMatchedIdentityKind() != null) {
                    kinds.merge(record.getMatchedIdentityKind(), 1L, Long::sum);
                }
            }
            if (record.isAttributed() && record.getProductCode() != null) {
                products.merge(record.getProductCode(), 1L, Long::sum);
            }
        }

        public Accumulator combine(Accumulator other) {
            total += other.total;
            resourceMatched += other.resourceMatched;
            tagMatched += other.tagMatched;
            tagsFailedToParse += other.tagsFailedToParse;
            other.kinds.forEach((kind, count) -> kinds.merge(kind, count, Long::sum));
            other.products.forEach((product, count) -> products.merge(product, count, Long::sum));
            return this;
        }

        public MatchStatistics toStatistics() {
            return new MatchStatistics(total, resourceMatched, tagMatched, kinds, tagsFailedToParse, products);
        }
    }
}
