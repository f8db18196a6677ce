package com.cloudcost.attribution.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Binding for all attribution engine settings.
 *
 * <pre>
 * attribution:
 *   enabled-tag-keys: openshift_cluster,openshift_node,openshift_project,app
 *   min-combined-match-rate: 0.70
 *   parallelism: 0
 *   streaming:
 *     use-streaming: auto
 *     threshold-rows: 500000
 *     memory-threshold-gb: 2.0
 *     chunk-size: 50000
 *   tags:
 *     prefix: resourceTags/
 *     direct-columns: openshift_cluster,openshift_node,...
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "attribution")
public class AttributionProperties {

    /**
     * Tag keys considered during matching. Empty = all tags.
     */
    private Set<String> enabledTagKeys = new LinkedHashSet<>();

    /**
     * Combined (resource id + tag) match rate below which a quality warning is raised.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minCombinedMatchRate = 0.70;

    /**
     * Worker threads for per-record processing. 0 = available processors.
     */
    @Min(0)
    private int parallelism = 0;

    @Valid
    private Streaming streaming = new Streaming();

    @Valid
    private Tags tags = new Tags();

    @Data
    public static class Streaming {

        /**
         * true, false or auto (case-insensitive).
         */
        @Pattern(regexp = "(?i)true|false|auto")
        private String useStreaming = "auto";

        @Min(1)
        private long thresholdRows = 500_000L;

        @DecimalMin("0.0")
        private double memoryThresholdGb = 2.0;

        @Min(1)
        private int chunkSize = 50_000;
    }

    @Data
    public static class Tags {

        @NotBlank
        private String prefix = "resourceTags/";

        /**
         * Columns holding a tag value directly, named after the tag itself.
         */
        private List<String> directColumns = new ArrayList<>(List.of(
                "openshift_cluster",
                "openshift_node",
                "openshift_project",
                "app",
                "component",
                "environment",
                "tier",
                "team",
                "nodeclass",
                "node_role_kubernetes_io",
                "version",
                "storageclass"
        ));
    }
}
