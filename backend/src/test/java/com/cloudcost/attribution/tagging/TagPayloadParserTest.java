package com.cloudcost.attribution.tagging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TagPayloadParserTest {

    private final TagPayloadParser parser = new TagPayloadParser(new ObjectMapper());

    @Nested
    @DisplayName("Resource Tag Payloads")
    class ResourceTagTests {

        @Test
        @DisplayName("Should parse a JSON object preserving key order")
        void shouldParseJsonObject() {
            var tags = parser.parseTags("{\"openshift_cluster\":\"prod\",\"app\":\"web\"}");

            assertThat(tags).isPresent();
            assertThat(tags.get()).containsExactly(
                    Map.entry("openshift_cluster", "prod"),
                    Map.entry("app", "web"));
        }

        @Test
        @DisplayName("Should treat null, blank and {} as zero tags without failing")
        void shouldTreatEmptyPayloadAsNoTags() {
            assertThat(parser.parseTags(null)).contains(Map.of());
            assertThat(parser.parseTags("  ")).contains(Map.of());
            assertThat(parser.parseTags("{}")).contains(Map.of());
        }

        @Test
        @DisplayName("Should report malformed or non-object JSON as a parse failure")
        void shouldFailOnMalformedPayload() {
            assertThat(parser.parseTags("{not json")).isEmpty();
            assertThat(parser.parseTags("[\"a\",\"b\"]")).isEmpty();
        }

        @Test
        @DisplayName("Should skip JSON null values")
        void shouldSkipNullValues() {
            var tags = parser.parseTags("{\"app\":null,\"team\":\"core\"}");

            assertThat(tags.get()).containsOnlyKeys("team");
        }
    }

    @Nested
    @DisplayName("Label Payloads")
    class LabelTests {

        @Test
        @DisplayName("Should parse pipe-delimited labels")
        void shouldParsePipeFormat() {
            var labels = parser.parseLabels("app:web|tier:frontend");

            assertThat(labels.get()).containsExactly(
                    Map.entry("app", "web"),
                    Map.entry("tier", "frontend"));
        }

        @Test
        @DisplayName("Should accept a single pipe-format pair")
        void shouldParseSinglePair() {
            assertThat(parser.parseLabels("app:web").get()).containsExactly(Map.entry("app", "web"));
        }

        @Test
        @DisplayName("Should parse JSON labels")
        void shouldParseJsonLabels() {
            assertThat(parser.parseLabels("{\"app\":\"db\"}").get()).containsEntry("app", "db");
        }

        @Test
        @DisplayName("Should report unrecognized formats as failures")
        void shouldFailOnUnknownFormat() {
            assertThat(parser.parseLabels("just-a-word")).isEmpty();
            assertThat(parser.parseLabels("{broken")).isEmpty();
        }
    }

    @Test
    @DisplayName("Should serialize empty tags as {} and round-trip non-empty ones")
    void shouldSerializeTags() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("app", "web");

        assertThat(parser.toPayload(Map.of())).isEqualTo("{}");
        assertThat(parser.toPayload(null)).isEqualTo("{}");
        assertThat(parser.parseTags(parser.toPayload(tags))).contains(tags);
    }
}
