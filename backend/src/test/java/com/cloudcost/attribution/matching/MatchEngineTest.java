package com.cloudcost.attribution.matching;

import com.cloudcost.attribution.domain.model.CostField;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.MatchKind;
import com.cloudcost.attribution.domain.model.ResourceMatchType;
import com.cloudcost.attribution.tagging.EnabledTagKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MatchEngine.
 *
 * Test strategy:
 * 1. Each priority rule in isolation
 * 2. Higher rules win when several apply
 * 3. Enabled tag keys restrict what can match
 * 4. Unmatched and already-matched records pass through unchanged
 */
class MatchEngineTest {

    private final MatchEngine engine = new MatchEngine();

    private final WorkloadIdentityIndex index = WorkloadIdentityIndex.builder()
            .clusterIds(List.of("cluster-a"))
            .clusterAliases(List.of("prod"))
            .nodeNames(List.of("worker-1"))
            .namespaces(List.of("payments"))
            .podLabelPairs(List.of("app=web"))
            .volumeLabelPairs(List.of("storageclass=gp3"))
            .build();

    private static CostRecord tagged(Map<String, String> tags) {
        return CostRecord.builder()
                .resourceIdentifier("i-0abc")
                .productCode("AmazonEC2")
                .consolidatedTags(tags)
                .build();
    }

    private static Map<String, String> tags(String... keyValues) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            tags.put(keyValues[i], keyValues[i + 1]);
        }
        return tags;
    }

    private CostRecord match(CostRecord record) {
        return engine.match(record, index, EnabledTagKeys.unrestricted());
    }

    @Nested
    @DisplayName("Priority Rule Tests")
    class PriorityTests {

        @Test
        @DisplayName("Should match cluster id")
        void shouldMatchClusterId() {
            CostRecord result = match(tagged(tags("openshift_cluster", "cluster-a")));

            assertThat(result.isTagMatched()).isTrue();
            assertThat(result.getMatchedIdentityKind()).isEqualTo(MatchKind.CLUSTER);
            assertThat(result.getMatchedTag()).isEqualTo("openshift_cluster=cluster-a");
        }

        @Test
        @DisplayName("Should match cluster alias with an alias qualifier")
        void shouldMatchClusterAlias() {
            CostRecord result = match(tagged(tags("openshift_cluster", "prod")));

            assertThat(result.getMatchedIdentityKind()).isEqualTo(MatchKind.CLUSTER_ALIAS);
            assertThat(result.getMatchedTag()).isEqualTo("openshift_cluster=prod (alias)");
        }

        @Test
        @DisplayName("Should match node and namespace tags")
        void shouldMatchNodeAndNamespace() {
            CostRecord node = match(tagged(tags("openshift_node", "worker-1")));
            CostRecord namespace = match(tagged(tags("openshift_project", "payments")));

            assertThat(node.getMatchedTag()).isEqualTo("openshift_node=worker-1");
            assertThat(node.getMatchedIdentityValue()).isEqualTo("worker-1");
            assertThat(namespace.getMatchedIdentityKind()).isEqualTo(MatchKind.NAMESPACE);
        }

        @Test
        @DisplayName("Should match pod labels before volume labels")
        void shouldMatchLabels() {
            CostRecord pod = match(tagged(tags("storageclass", "gp3", "app", "web")));
            CostRecord volume = match(tagged(tags("storageclass", "gp3")));

            assertThat(pod.getMatchedTag()).isEqualTo("app=web (pod_labels)");
            assertThat(pod.getMatchedIdentityValue()).isEqualTo("app=web");
            assertThat(volume.getMatchedTag()).isEqualTo("storageclass=gp3 (volume_labels)");
        }

        @Test
        @DisplayName("Should prefer the highest-priority rule regardless of tag order")
        void shouldApplyPriorityOrder() {
            // Given
            CostRecord record = tagged(tags(
                    "app", "web",
                    "openshift_project", "payments",
                    "openshift_node", "worker-1",
                    "openshift_cluster", "cluster-a"));

            // When
            CostRecord result = match(record);

            // Then
            assertThat(result.getMatchedIdentityKind()).isEqualTo(MatchKind.CLUSTER);
        }

        @Test
        @DisplayName("Should fall through to the next rule when a special tag does not match")
        void shouldFallThroughUnknownValues() {
            CostRecord result = match(tagged(tags(
                    "openshift_cluster", "unknown",
                    "openshift_node", "worker-1")));

            assertThat(result.getMatchedIdentityKind()).isEqualTo(MatchKind.NODE);
        }

        @Test
        @DisplayName("Should give the same answer for the same inputs")
        void shouldBeDeterministic() {
            CostRecord record = tagged(tags("openshift_node", "worker-1", "app", "web"));

            assertThat(match(record).getMatchedTag()).isEqualTo(match(record).getMatchedTag());
        }

        @Test
        @DisplayName("Should not use special tags for label matching")
        void shouldExcludeSpecialTagsFromLabels() {
            WorkloadIdentityIndex labelsOnly = WorkloadIdentityIndex.builder()
                    .podLabelPairs(List.of("openshift_node=worker-9"))
                    .build();

            var match = engine.findMatch(tags("openshift_node", "worker-9"), labelsOnly);

            assertThat(match).isEmpty();
        }
    }

    @Nested
    @DisplayName("Pass-through Tests")
    class PassThroughTests {

        @Test
        @DisplayName("Should leave an unmatched record unchanged")
        void shouldLeaveUnmatchedRecord() {
            CostRecord record = tagged(tags("team", "finops"));

            CostRecord result = match(record);

            assertThat(result).isSameAs(record);
            assertThat(result.isTagMatched()).isFalse();
            assertThat(result.getMatchedTag()).isNull();
        }

        @Test
        @DisplayName("Should leave a record without tags unmatched")
        void shouldHandleMissingTags() {
            CostRecord record = CostRecord.builder().resourceIdentifier("i-0abc").build();

            assertThat(match(record).isTagMatched()).isFalse();
        }

        @Test
        @DisplayName("Should not tag-match a record already matched by resource id")
        void shouldSkipResourceMatchedRecord() {
            CostRecord record = tagged(tags("openshift_cluster", "cluster-a")).toBuilder()
                    .resourceMatched(true)
                    .matchedResourceId("i-0abc")
                    .resourceMatchType(ResourceMatchType.NODE)
                    .build();

            CostRecord result = match(record);

            assertThat(result.isResourceMatched()).isTrue();
            assertThat(result.isTagMatched()).isFalse();
        }
    }

    @Nested
    @DisplayName("Enabled Tag Key Tests")
    class EnabledKeyTests {

        @Test
        @DisplayName("Should ignore tags whose keys are not enabled")
        void shouldRestrictToEnabledKeys() {
            // Given
            CostRecord record = tagged(tags("openshift_cluster", "cluster-a", "app", "web"));

            // When
            CostRecord result = engine.match(record, index, EnabledTagKeys.of(List.of("app")));

            // Then
            assertThat(result.getMatchedIdentityKind()).isEqualTo(MatchKind.POD_LABEL);
            assertThat(result.getConsolidatedTags()).containsKey("openshift_cluster");
        }

        @Test
        @DisplayName("Should match nothing when no enabled key is present")
        void shouldMatchNothingWithoutEnabledKeys() {
            CostRecord record = tagged(tags("openshift_cluster", "cluster-a"));

            CostRecord result = engine.match(record, index, EnabledTagKeys.of(List.of("team")));

            assertThat(result.isTagMatched()).isFalse();
        }
    }

    @Nested
    @DisplayName("Schema Tests")
    class SchemaTests {

        @Test
        @DisplayName("Should disable tag matching when resource tags are not in the schema")
        void shouldDisableWithoutResourceTags() {
            EnumSet<CostField> schema = EnumSet.allOf(CostField.class);
            schema.remove(CostField.RESOURCE_TAGS);

            assertThat(engine.checkSchema(schema)).hasValueSatisfying(rule ->
                    assertThat(rule.rule()).isEqualTo(MatchEngine.TAG_MATCHING_RULE));
            assertThat(engine.checkSchema(EnumSet.allOf(CostField.class))).isEmpty();
        }
    }
}
