package com.cloudcost.attribution.classification;

import com.cloudcost.attribution.domain.model.CostField;
import com.cloudcost.attribution.domain.model.CostRecord;
import com.cloudcost.attribution.domain.model.DataTransferDirection;
import com.cloudcost.attribution.domain.model.DisabledRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CostClassifier with its real rule collaborators.
 *
 * Test strategy:
 * 1. Network direction detection for every usage type pattern
 * 2. Savings plan zeroing and amortized cost per line item type
 * 3. Rules disabled by a missing schema column
 */
class CostClassifierTest {

    private final CostClassifier classifier =
            new CostClassifier(new DataTransferDirectionResolver(), new SavingsPlanNormalizer());

    private static CostRecord.CostRecordBuilder dataTransfer(String usageType, String operation) {
        return CostRecord.builder()
                .productCode("AmazonEC2")
                .productFamily("Data Transfer")
                .lineItemType("Usage")
                .usageType(usageType)
                .operation(operation)
                .unblendedCost(new BigDecimal("1.50"));
    }

    @Nested
    @DisplayName("Network Direction Tests")
    class NetworkDirectionTests {

        @ParameterizedTest(name = "{0} / {1} -> {2}")
        @CsvSource({
                "USE1-DataTransfer-In-Bytes, RunInstances, IN",
                "USE1-DataTransfer-Out-Bytes, RunInstances, OUT",
                "USE1-DataTransfer-Regional-Bytes, InterZone-In, IN",
                "USE1-DataTransfer-Regional-Bytes, InterZone-Out, OUT"
        })
        @DisplayName("Should derive direction from usage type and operation")
        void shouldDetectDirection(String usageType, String operation, DataTransferDirection expected) {
            CostRecord result = classifier.classify(dataTransfer(usageType, operation).build());

            assertThat(result.getDataTransferDirection()).isEqualTo(expected);
            assertThat(result.isNetworkCost()).isTrue();
        }

        @Test
        @DisplayName("Should leave direction unset for regional transfer without a direction in the operation")
        void shouldLeaveUnknownRegionalUnset() {
            CostRecord result = classifier.classify(
                    dataTransfer("USE1-DataTransfer-Regional-Bytes", "InterZone").build());

            assertThat(result.getDataTransferDirection()).isNull();
        }

        @Test
        @DisplayName("Should not classify non-EC2 or non data transfer records")
        void shouldIgnoreOtherProducts() {
            CostRecord s3 = dataTransfer("USE1-DataTransfer-Out-Bytes", "GetObject")
                    .productCode("AmazonS3")
                    .build();
            CostRecord compute = dataTransfer("BoxUsage:m5.large", "RunInstances")
                    .productFamily("Compute Instance")
                    .build();

            assertThat(classifier.classify(s3).isNetworkCost()).isFalse();
            assertThat(classifier.classify(compute).isNetworkCost()).isFalse();
        }

        @Test
        @DisplayName("Should keep an existing direction")
        void shouldNotOverwriteDirection() {
            CostRecord record = dataTransfer("USE1-DataTransfer-In-Bytes", "RunInstances")
                    .dataTransferDirection(DataTransferDirection.OUT)
                    .build();

            assertThat(classifier.classify(record).getDataTransferDirection()).isEqualTo(DataTransferDirection.OUT);
        }
    }

    @Nested
    @DisplayName("Savings Plan Tests")
    class SavingsPlanTests {

        @Test
        @DisplayName("Should zero covered usage with positive effective cost")
        void shouldZeroCoveredUsage() {
            // Given
            CostRecord record = CostRecord.builder()
                    .lineItemType("SavingsPlanCoveredUsage")
                    .unblendedCost(new BigDecimal("2.00"))
                    .blendedCost(new BigDecimal("1.90"))
                    .savingsPlanEffectiveCost(new BigDecimal("1.20"))
                    .build();

            // When
            CostRecord result = classifier.classify(record);

            // Then
            assertThat(result.getUnblendedCost()).isEqualByComparingTo("0");
            assertThat(result.getBlendedCost()).isEqualByComparingTo("0");
            assertThat(result.getAmortizedCost()).isEqualByComparingTo("1.20");
        }

        @Test
        @DisplayName("Should keep costs of covered usage without a positive effective cost")
        void shouldKeepCoveredUsageWithoutEffectiveCost() {
            CostRecord record = CostRecord.builder()
                    .lineItemType("SavingsPlanCoveredUsage")
                    .unblendedCost(new BigDecimal("2.00"))
                    .savingsPlanEffectiveCost(BigDecimal.ZERO)
                    .build();

            CostRecord result = classifier.classify(record);

            assertThat(result.getUnblendedCost()).isEqualByComparingTo("2.00");
            assertThat(result.getAmortizedCost()).isEqualByComparingTo("0");
        }

        @ParameterizedTest(name = "{0} amortizes to {1}")
        @CsvSource({
                "Usage, 3.00",
                "Tax, 3.00",
                "DiscountedUsage, 0.75",
                "SavingsPlanRecurringFee, 0.75"
        })
        @DisplayName("Should amortize Tax and Usage to unblended cost and everything else to effective cost")
        void shouldComputeAmortizedCost(String lineItemType, String expected) {
            CostRecord record = CostRecord.builder()
                    .lineItemType(lineItemType)
                    .unblendedCost(new BigDecimal("3.00"))
                    .savingsPlanEffectiveCost(new BigDecimal("0.75"))
                    .build();

            assertThat(classifier.classify(record).getAmortizedCost()).isEqualByComparingTo(expected);
        }

        @Test
        @DisplayName("Should amortize a line without a type to its effective cost")
        void shouldHandleMissingLineItemType() {
            CostRecord record = CostRecord.builder()
                    .unblendedCost(new BigDecimal("4.00"))
                    .savingsPlanEffectiveCost(new BigDecimal("0.40"))
                    .build();

            CostRecord result = classifier.classify(record);

            assertThat(result.getUnblendedCost()).isEqualByComparingTo("4.00");
            assertThat(result.getAmortizedCost()).isEqualByComparingTo("0.40");
        }

        @Test
        @DisplayName("Should amortize to zero when effective cost is absent")
        void shouldDefaultMissingEffectiveCost() {
            CostRecord record = CostRecord.builder()
                    .lineItemType("RIFee")
                    .unblendedCost(new BigDecimal("5.00"))
                    .build();

            assertThat(classifier.classify(record).getAmortizedCost()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("Schema Precondition Tests")
    class SchemaTests {

        @Test
        @DisplayName("Should enable every rule for a complete schema")
        void shouldEnableAllRules() {
            ClassificationPlan plan = classifier.plan(EnumSet.allOf(CostField.class));

            assertThat(plan.networkDetection()).isTrue();
            assertThat(plan.savingsPlanNormalization()).isTrue();
            assertThat(plan.disabledRules()).isEmpty();
        }

        @Test
        @DisplayName("Should disable network detection without product family and keep savings plan rule")
        void shouldDisableNetworkDetection() {
            // Given
            EnumSet<CostField> schema = EnumSet.allOf(CostField.class);
            schema.remove(CostField.PRODUCT_FAMILY);

            // When
            ClassificationPlan plan = classifier.plan(schema);
            CostRecord result = classifier.classify(
                    dataTransfer("USE1-DataTransfer-In-Bytes", "RunInstances").build(), plan);

            // Then
            assertThat(plan.networkDetection()).isFalse();
            assertThat(plan.savingsPlanNormalization()).isTrue();
            assertThat(plan.disabledRules())
                    .extracting(DisabledRule::rule)
                    .containsExactly(CostClassifier.NETWORK_DETECTION_RULE);
            assertThat(result.getDataTransferDirection()).isNull();
            assertThat(result.getAmortizedCost()).isEqualByComparingTo("1.50");
        }

        @Test
        @DisplayName("Should disable savings plan normalization without line item type")
        void shouldDisableSavingsPlanNormalization() {
            // Given
            EnumSet<CostField> schema = EnumSet.allOf(CostField.class);
            schema.remove(CostField.LINE_ITEM_TYPE);
            CostRecord record = CostRecord.builder()
                    .lineItemType("SavingsPlanCoveredUsage")
                    .unblendedCost(new BigDecimal("2.00"))
                    .savingsPlanEffectiveCost(new BigDecimal("1.00"))
                    .build();

            // When
            ClassificationPlan plan = classifier.plan(schema);
            CostRecord result = classifier.classify(record, plan);

            // Then
            assertThat(plan.disabledRules()).singleElement()
                    .satisfies(rule -> assertThat(rule.missingFields()).containsExactly(CostField.LINE_ITEM_TYPE));
            assertThat(result.getUnblendedCost()).isEqualByComparingTo("2.00");
            assertThat(result.getAmortizedCost()).isNull();
        }
    }
}
