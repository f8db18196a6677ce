package com.cloudcost.attribution.tagging;

import com.cloudcost.attribution.config.AttributionProperties;
import com.cloudcost.attribution.domain.model.CostField;
import com.cloudcost.attribution.domain.model.CostRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses sparse tag columns into one canonical tag map per record.
 *
 * COLUMN SCHEMES:
 * 1. Prefixed columns ({@code resourceTags/user:app}) - prefix stripped
 * 2. Direct columns from an allow-list ({@code openshift_cluster}, {@code app}, ...)
 *
 * Both schemes are {@link TagSource} adapters feeding the same consolidation loop.
 * Sources are applied in order, so a direct column overrides a prefixed column
 * carrying the same tag name. Null and empty values never become tags.
 *
 * After consolidation the raw columns are dropped from the record; the tag map is
 * the only surviving form. Consolidating a record without raw columns keeps the
 * tags it already has, which makes re-runs a no-op.
 */
@Component
@Slf4j
public class TagConsolidator {

    private final List<TagSource> sources;
    private final TagPayloadParser payloadParser;

    @Autowired
    public TagConsolidator(AttributionProperties properties, TagPayloadParser payloadParser) {
        this(List.of(
                new PrefixedTagSource(properties.getTags().getPrefix()),
                new DirectTagSource(properties.getTags().getDirectColumns())
        ), payloadParser);
    }

    public TagConsolidator(List<TagSource> sources, TagPayloadParser payloadParser) {
        this.sources = List.copyOf(sources);
        this.payloadParser = payloadParser;
    }

    public CostRecord consolidate(CostRecord record) {
        Map<String, String> rawColumns = record.getRawTagColumns();

        if (rawColumns == null || rawColumns.isEmpty()) {
            if (record.hasConsolidatedTags()) {
                return record;
            }
            return fromPayload(record);
        }

        Map<String, String> tags = new LinkedHashMap<>();
        if (record.hasConsolidatedTags()) {
            tags.putAll(record.getConsolidatedTags());
        }
        for (TagSource source : sources) {
            Iterator<Map.Entry<String, String>> entries = source.tags(rawColumns);
            while (entries.hasNext()) {
                Map.Entry<String, String> entry = entries.next();
                String value = entry.getValue();
                if (value != null && !value.isEmpty()) {
                    tags.put(entry.getKey(), value);
                }
            }
        }

        return record.toBuilder()
                .rawTagColumns(Map.of())
                .consolidatedTags(Collections.unmodifiableMap(tags))
                .build();
    }

    /**
     * Whether any configured source recognizes the column as a tag column.
     */
    public boolean isTagColumn(String columnName) {
        return sources.stream().anyMatch(source -> source.claims(columnName));
    }

    /**
     * Schema declared by a report with the given columns; either tag naming scheme
     * declares the resource tags.
     */
    public Set<CostField> schemaOf(Collection<String> columnNames) {
        return CostField.fromColumns(columnNames, this::isTagColumn);
    }

    /**
     * External form of a record's tags; {@code {}} when there are none.
     */
    public String toPayload(CostRecord record) {
        return payloadParser.toPayload(record.getConsolidatedTags());
    }

    private CostRecord fromPayload(CostRecord record) {
        if (record.getTagPayload() == null) {
            return record.toBuilder()
                    .consolidatedTags(Map.of())
                    .build();
        }

        Optional<Map<String, String>> parsed = payloadParser.parseTags(record.getTagPayload());
        if (parsed.isEmpty()) {
            log.debug("Tags of {} could not be parsed, treating as untagged", record.getResourceIdentifier());
        }
        return record.toBuilder()
                .rawTagColumns(Map.of())
                .consolidatedTags(parsed.orElse(Map.of()))
                .tagParseFailed(parsed.isEmpty())
                .build();
    }
}
