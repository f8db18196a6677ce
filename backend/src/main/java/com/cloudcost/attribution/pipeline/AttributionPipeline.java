package com.cloudcost.attribution.pipeline;

import com.cloudcost.attribution.classification.ClassificationPlan;
import com.cloudcost.attribution.classification.CostClassifier;
import com.cloudcost.attribution.config.AttributionProperties;
import com.cloudcost.attribution.domain.model.CostBatch;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DisabledRule;
import com.cloudcost.attribution.domain.model.MatchKind;
import com.cloudcost.attribution.matching.MatchEngine;
import com.cloudcost.attribution.matching.MatchStatistics;
import com.cloudcost.attribution.matching.QualityWarning;
import com.cloudcost.attribution.matching.ResourceIdMatcher;
import com.cloudcost.attribution.matching.WorkloadIdentityIndex;
import com.cloudcost.attribution.streaming.StreamingDecision;
import com.cloudcost.attribution.streaming.StreamingModeSelector;
import com.cloudcost.attribution.tagging.EnabledTagKeys;
import com.cloudcost.attribution.tagging.TagConsolidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Runs a cost batch through the full attribution flow.
 *
 * PER-RECORD STAGES:
 * 1. Tag consolidation
 * 2. Cost classification (network direction, savings plan normalization)
 * 3. Resource-id matching (optional)
 * 4. Tag matching
 *
 * Each stage maps a record to a new record, so a chunk is processed with a parallel
 * map on the dedicated worker pool. Chunks run one after another; their statistics
 * are merged as they complete. Schema checks happen once per batch, before any
 * worker starts.
 *
 * CANCELLATION:
 * The caller's cancellation signal is polled between chunks. Work already done is
 * kept and the result is flagged as cancelled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttributionPipeline {

    private final TagConsolidator tagConsolidator;
    private final CostClassifier costClassifier;
    private final ResourceIdMatcher resourceIdMatcher;
    private final MatchEngine matchEngine;
    private final StreamingModeSelector streamingModeSelector;
    private final ForkJoinPool attributionWorkerPool;
    private final AttributionProperties properties;

    public AttributionResult process(CostBatch batch, WorkloadIdentityIndex index) {
        return process(batch, index, AttributionOptions.defaults());
    }

    public AttributionResult process(CostBatch batch, WorkloadIdentityIndex index, AttributionOptions options) {
        long startTime = System.currentTimeMillis();
        List<CostRecord> records = batch.records();

        StreamingDecision decision = streamingModeSelector.decide((long) records.size(), options.getForceStreaming());

        ClassificationPlan plan = costClassifier.plan(batch.schema());
        Optional<DisabledRule> tagMatchingDisabled = matchEngine.checkSchema(batch.schema());
        List<DisabledRule> disabledRules = new ArrayList<>(plan.disabledRules());
        tagMatchingDisabled.ifPresent(disabledRules::add);

        EnabledTagKeys enabledTagKeys = options.getEnabledTagKeys() != null
                ? options.getEnabledTagKeys()
                : EnabledTagKeys.of(properties.getEnabledTagKeys());

        UnaryOperator<CostRecord> stages = recordStages(plan, index, enabledTagKeys,
                options.isApplyResourceIdMatching(), tagMatchingDisabled.isEmpty());

        int chunkSize = Math.max(1, Math.min(decision.chunkSize(), records.size()));
        List<CostRecord> output = new ArrayList<>(records.size());
        MatchStatistics statistics = MatchStatistics.empty();
        int chunks = 0;
        boolean cancelled = false;

        for (int from = 0; from < records.size(); from += chunkSize) {
            if (options.getCancellation().getAsBoolean()) {
                log.warn("Attribution cancelled after {} chunks ({} of {} records processed)",
                        chunks, output.size(), records.size());
                cancelled = true;
                break;
            }

            List<CostRecord> chunk = records.subList(from, Math.min(from + chunkSize, records.size()));
            ChunkResult result = processChunk(chunk, stages);
            output.addAll(result.records());
            statistics = statistics.merge(result.statistics());
            chunks++;

            if (decision.streaming()) {
                log.debug("Processed chunk {}: {} records ({} total)", chunks, chunk.size(), output.size());
            }
        }

        QualityWarning warning = QualityWarning.evaluate(statistics, properties.getMinCombinedMatchRate())
                .orElse(null);
        if (warning != null) {
            log.warn(warning.message());
        }

        logSummary(statistics, chunks, System.currentTimeMillis() - startTime);

        return new AttributionResult(output, statistics, warning, disabledRules, decision, chunks, cancelled);
    }

    private UnaryOperator<CostRecord> recordStages(ClassificationPlan plan, WorkloadIdentityIndex index,
                                                   EnabledTagKeys enabledTagKeys,
                                                   boolean resourceIdMatching, boolean tagMatching) {
        return record -> {
            CostRecord result = tagConsolidator.consolidate(record);
            result = costClassifier.classify(result, plan);
            if (resourceIdMatching) {
                result = resourceIdMatcher.match(result, index);
            }
            if (tagMatching) {
                result = matchEngine.match(result, index, enabledTagKeys);
            }
            return result;
        };
    }

    private ChunkResult processChunk(List<CostRecord> chunk, UnaryOperator<CostRecord> stages) {
        try {
            return attributionWorkerPool.submit(() -> {
                List<CostRecord> processed = chunk.parallelStream()
                        .map(stages)
                        .collect(Collectors.toList());
                MatchStatistics statistics = processed.parallelStream()
                        .collect(MatchStatistics.collector());
                return new ChunkResult(processed, statistics);
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AttributionProcessingException("Attribution interrupted", e);
        } catch (ExecutionException e) {
            throw new AttributionProcessingException("Attribution worker failed: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }

    private void logSummary(MatchStatistics statistics, int chunks, long elapsedMs) {
        log.info("Attribution complete: {} records in {} chunks ({} ms)", statistics.totalRecords(), chunks, elapsedMs);
        log.info("  Resource id matches: {}", statistics.resourceMatched());
        log.info("  Tag matches: {}", statistics.tagMatched());
        for (MatchKind kind : MatchKind.values()) {
            log.info("    {}: {}", kind.getDisplayName(), statistics.matchesOf(kind));
        }
        log.info("  Combined match rate: {}% ({} unmatched)",
                String.format("%.1f", statistics.combinedMatchRate() * 100), statistics.unmatched());
        if (statistics.tagsFailedToParse() > 0) {
            log.warn("  Tag payloads that failed to parse: {}", statistics.tagsFailedToParse());
        }
        if (!statistics.matchedByProduct().isEmpty()) {
            log.debug("  Matches by product: {}", statistics.matchedByProduct());
        }
    }

    private record ChunkResult(List<CostRecord> records, MatchStatistics statistics) {
    }
}
