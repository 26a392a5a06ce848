package com.chicu.mlcore.ml.features;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Какие поля события превращаются в признаки.
 * Каждый временной признак даёт две колонки: час и день недели (пн = 0).
 */
public record FeatureConfig(
        @JsonProperty("numerical_features") List<String> numericalFeatures,
        @JsonProperty("categorical_features") List<String> categoricalFeatures,
        @JsonProperty("temporal_features") List<String> temporalFeatures,
        @JsonProperty("use_normalization") boolean useNormalization
) {

    public FeatureConfig {
        numericalFeatures = numericalFeatures == null ? List.of() : List.copyOf(numericalFeatures);
        categoricalFeatures = categoricalFeatures == null ? List.of() : List.copyOf(categoricalFeatures);
        temporalFeatures = temporalFeatures == null ? List.of() : List.copyOf(temporalFeatures);
        if (numericalFeatures.isEmpty() && categoricalFeatures.isEmpty() && temporalFeatures.isEmpty()) {
            throw new IllegalArgumentException("FeatureConfig: нет ни одного признака");
        }
    }

    public static FeatureConfig defaults() {
        return new FeatureConfig(
                List.of("duration", "cost"),
                List.of("activity", "resource"),
                List.of("timestamp"),
                true
        );
    }
}
