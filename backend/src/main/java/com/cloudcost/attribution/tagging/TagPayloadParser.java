package com.cloudcost.attribution.tagging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses serialized tag and label payloads.
 *
 * SUPPORTED FORMATS:
 * - AWS resource tags: JSON object, {@code {"app":"web","openshift_node":"worker-1"}}
 * - OpenShift labels: JSON object, or pipe format {@code app:web|tier:frontend}
 *
 * A payload that cannot be parsed yields {@link Optional#empty()}; callers treat it
 * as zero tags and count it. Null or blank payloads are simply empty, not failures.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TagPayloadParser {

    static final String EMPTY_PAYLOAD = "{}";

    private final ObjectMapper objectMapper;

    /**
     * Parse an AWS resource tag payload. Only JSON objects are accepted.
     */
    public Optional<Map<String, String>> parseTags(String payload) {
        if (payload == null || payload.isBlank() || EMPTY_PAYLOAD.equals(payload.trim())) {
            return Optional.of(Map.of());
        }
        return parseJsonObject(payload);
    }

    /**
     * Parse an OpenShift label payload in JSON or pipe format.
     */
    public Optional<Map<String, String>> parseLabels(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.of(Map.of());
        }
        String trimmed = payload.trim();
        if (trimmed.startsWith("{")) {
            return parseJsonObject(trimmed);
        }
        if (trimmed.contains(":")) {
            return parsePipeFormat(trimmed);
        }
        log.debug("Unrecognized label payload format: {}", payload);
        return Optional.empty();
    }

    /**
     * Serialize a tag map. An empty map is written as {@code {}}, never null.
     */
    public String toPayload(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return EMPTY_PAYLOAD;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tag map", e);
        }
    }

    private Optional<Map<String, String>> parseJsonObject(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                log.debug("Tag payload is not a JSON object: {}", payload);
                return Optional.empty();
            }
            Map<String, String> tags = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isNull()) {
                    continue;
                }
                tags.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
            return Optional.of(Collections.unmodifiableMap(tags));
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse tag payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<Map<String, String>> parsePipeFormat(String payload) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String pair : payload.split("\\|")) {
            int separator = pair.indexOf(':');
            if (separator < 0) {
                // entries without a separator carry no value; skip them
                continue;
            }
            String key = pair.substring(0, separator).trim();
            if (!key.isEmpty()) {
                labels.put(key, pair.substring(separator + 1).trim());
            }
        }
        return Optional.of(Collections.unmodifiableMap(labels));
    }
}
