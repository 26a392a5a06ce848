package com.chicu.mlcore.ml.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Одна зарегистрированная версия. Поля копируются из манифеста в момент register().
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelVersionInfo(
        @JsonProperty("version") String version,
        @JsonProperty("model_path") String modelPath,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("trained_at") Instant trainedAt,
        @JsonProperty("performance_metrics") Map<String, Double> performanceMetrics,
        @JsonProperty("hyperparameters") Map<String, Object> hyperparameters,
        @JsonProperty("training_samples") int trainingSamples,
        @JsonProperty("status") String status,
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("input_schema_version") String inputSchemaVersion
) {

    public ModelVersionInfo {
        performanceMetrics = performanceMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(performanceMetrics));
        hyperparameters = hyperparameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hyperparameters));
    }
}
