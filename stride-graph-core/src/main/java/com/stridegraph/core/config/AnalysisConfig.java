package com.stridegraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stridegraph.core.model.ComponentType;
import com.stridegraph.core.model.StrideCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tuning knobs for one analysis run.
 *
 * <p>Every field has a documented default, applied when the value is absent (null) so the
 * record can be deserialized from a partial {@code analysis:} YAML section.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   confidenceThreshold: 0.3
 *   iouThreshold: 0.5
 *   proximityThreshold: 0.4
 *   severityWeights:
 *     REPUDIATION: 5.0
 *   labelAliases:
 *     "k8s pod": SERVER
 * }</pre>
 *
 * @param confidenceThreshold detections below this confidence are dropped (default 0.25)
 * @param iouThreshold detections overlapping above this IoU are merged (default 0.5)
 * @param proximityThreshold pairs scoring above this proximity are connected (default 0.4)
 * @param severityWeights base severity per STRIDE category; missing categories use defaults
 * @param labelAliases extra label-to-type mappings added to the built-in alias table
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    @JsonProperty("confidenceThreshold") Double confidenceThreshold,
    @JsonProperty("iouThreshold") Double iouThreshold,
    @JsonProperty("proximityThreshold") Double proximityThreshold,
    @JsonProperty("severityWeights") Map<StrideCategory, Double> severityWeights,
    @JsonProperty("labelAliases") Map<String, ComponentType> labelAliases
) {
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.25;
    public static final double DEFAULT_IOU_THRESHOLD = 0.5;
    public static final double DEFAULT_PROXIMITY_THRESHOLD = 0.4;

    private static final Map<StrideCategory, Double> DEFAULT_WEIGHTS = defaultWeights();

    /**
     * Compact constructor applying defaults and validating ranges.
     */
    public AnalysisConfig {
        confidenceThreshold = unitInterval("confidenceThreshold", confidenceThreshold, DEFAULT_CONFIDENCE_THRESHOLD);
        iouThreshold = unitInterval("iouThreshold", iouThreshold, DEFAULT_IOU_THRESHOLD);
        proximityThreshold = unitInterval("proximityThreshold", proximityThreshold, DEFAULT_PROXIMITY_THRESHOLD);

        EnumMap<StrideCategory, Double> weights = new EnumMap<>(DEFAULT_WEIGHTS);
        if (severityWeights != null) {
            severityWeights.forEach((category, weight) -> {
                if (category == null || weight == null) {
                    return;
                }
                if (!Double.isFinite(weight) || weight < 0.0) {
                    throw new IllegalArgumentException(
                        "Severity weight for " + category + " must be a non-negative number, got " + weight);
                }
                weights.put(category, weight);
            });
        }
        severityWeights = Collections.unmodifiableMap(weights);

        labelAliases = labelAliases == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labelAliases));
    }

    /**
     * Creates a configuration with all defaults.
     *
     * @return default analysis config
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(null, null, null, null, null);
    }

    /**
     * Returns the default per-category weights.
     *
     * @return immutable copy of the default weights
     */
    public static Map<StrideCategory, Double> defaultSeverityWeights() {
        return DEFAULT_WEIGHTS;
    }

    /**
     * Returns the base severity for a category.
     *
     * @param category STRIDE category
     * @return configured weight
     */
    public double baseSeverity(StrideCategory category) {
        return severityWeights.get(category);
    }

    /**
     * Returns a builder seeded with this configuration.
     *
     * @return builder
     */
    public Builder toBuilder() {
        return new Builder()
            .confidenceThreshold(confidenceThreshold)
            .iouThreshold(iouThreshold)
            .proximityThreshold(proximityThreshold)
            .severityWeights(severityWeights)
            .labelAliases(labelAliases);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Double unitInterval(String name, Double value, double defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
        }
        return value;
    }

    private static Map<StrideCategory, Double> defaultWeights() {
        EnumMap<StrideCategory, Double> weights = new EnumMap<>(StrideCategory.class);
        weights.put(StrideCategory.SPOOFING, 7.0);
        weights.put(StrideCategory.TAMPERING, 9.0);
        weights.put(StrideCategory.REPUDIATION, 4.0);
        weights.put(StrideCategory.INFORMATION_DISCLOSURE, 8.0);
        weights.put(StrideCategory.DENIAL_OF_SERVICE, 6.0);
        weights.put(StrideCategory.ELEVATION_OF_PRIVILEGE, 10.0);
        return Collections.unmodifiableMap(weights);
    }

    /**
     * Builder for constructing AnalysisConfig incrementally.
     */
    public static class Builder {
        private Double confidenceThreshold;
        private Double iouThreshold;
        private Double proximityThreshold;
        private Map<StrideCategory, Double> severityWeights;
        private Map<String, ComponentType> labelAliases;

        public Builder confidenceThreshold(Double value) {
            this.confidenceThreshold = value;
            return this;
        }

        public Builder iouThreshold(Double value) {
            this.iouThreshold = value;
            return this;
        }

        public Builder proximityThreshold(Double value) {
            this.proximityThreshold = value;
            return this;
        }

        public Builder severityWeights(Map<StrideCategory, Double> value) {
            this.severityWeights = value;
            return this;
        }

        public Builder labelAliases(Map<String, ComponentType> value) {
            this.labelAliases = value;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(
                confidenceThreshold,
                iouThreshold,
                proximityThreshold,
                severityWeights,
                labelAliases
            );
        }
    }
}
