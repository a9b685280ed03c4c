package com.stridegraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for StrideGraph.
 *
 * <p>Loaded from {@code stridegraph.yaml}. Missing sections fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   confidenceThreshold: 0.25
 *   iouThreshold: 0.5
 *   proximityThreshold: 0.4
 *
 * rules:
 *   additionalFiles:
 *     - ./rules/cloud-extras.yaml
 *
 * output:
 *   directory: "./reports"
 *   formats:
 *     - markdown
 *     - json
 * }</pre>
 *
 * @param analysis analysis thresholds and weights
 * @param rules rule table sources
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrideConfig(
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("rules") RulesConfig rules,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling missing sections.
     */
    public StrideConfig {
        if (analysis == null) {
            analysis = AnalysisConfig.defaults();
        }
        if (rules == null) {
            rules = RulesConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: bundled rule table, Markdown and JSON output.
     *
     * @return default configuration
     */
    public static StrideConfig defaults() {
        return new StrideConfig(null, null, null);
    }

    /**
     * Rule table sources.
     *
     * @param file replacement rule table (null = bundled table)
     * @param additionalFiles rule files whose entries are appended to the table
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RulesConfig(
        @JsonProperty("file") String file,
        @JsonProperty("additionalFiles") List<String> additionalFiles
    ) {
        public RulesConfig {
            additionalFiles = additionalFiles == null ? List.of() : List.copyOf(additionalFiles);
        }

        public static RulesConfig defaults() {
            return new RulesConfig(null, List.of());
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param formats report formats to write ({@code markdown}, {@code json})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = "./stride-reports";
            }
            formats = formats == null || formats.isEmpty()
                ? List.of("markdown", "json")
                : List.copyOf(formats);
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }
}
