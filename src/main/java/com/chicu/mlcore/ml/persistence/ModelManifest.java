package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.common.enums.ModelStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Манифест одной обученной версии модели (manifest.json в каталоге версии).
 * <p>
 * artifacts заполняется только в save() и каждый раз заменяется целиком.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelManifest {

    public static final String CURRENT_SCHEMA_VERSION = "1.1";
    public static final Set<String> SUPPORTED_SCHEMA_VERSIONS = Set.of("1.0", "1.1");

    /** Ключи manifest.json, без которых загрузка невозможна (trained_at необязателен). */
    public static final List<String> REQUIRED_FIELDS = List.of(
            "schema_version", "model_id", "model_type", "version", "created_at",
            "hyperparameters", "performance_metrics", "training_samples", "status",
            "artifacts", "dependencies", "input_schema_version"
    );

    /** Ключ обязан быть, но значение null допустимо. */
    public static final Set<String> NULLABLE_FIELDS = Set.of("input_schema_version");

    @JsonProperty("schema_version")
    private String schemaVersion;

    @JsonProperty("model_id")
    private String modelId;

    @JsonProperty("model_type")
    private String modelType;

    @JsonProperty("version")
    private String version;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("trained_at")
    private Instant trainedAt;

    @Builder.Default
    @JsonProperty("hyperparameters")
    private Map<String, Object> hyperparameters = new LinkedHashMap<>();

    @Builder.Default
    @JsonProperty("performance_metrics")
    private Map<String, Double> performanceMetrics = new LinkedHashMap<>();

    @JsonProperty("training_samples")
    private int trainingSamples;

    @JsonProperty("status")
    private ModelStatus status;

    @Builder.Default
    @JsonProperty("artifacts")
    private List<ArtifactSpec> artifacts = new ArrayList<>();

    @Builder.Default
    @JsonProperty("dependencies")
    private Map<String, String> dependencies = new LinkedHashMap<>();

    @JsonProperty("input_schema_version")
    private String inputSchemaVersion;

    /**
     * Снимок для выдачи наружу (TrainingResult, реестр): коллекции копируются,
     * чтобы внешний код не мутировал живой манифест модели.
     */
    public ModelManifest copy() {
        return ModelManifest.builder()
                .schemaVersion(schemaVersion)
                .modelId(modelId)
                .modelType(modelType)
                .version(version)
                .createdAt(createdAt)
                .trainedAt(trainedAt)
                .hyperparameters(hyperparameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(hyperparameters))
                .performanceMetrics(performanceMetrics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(performanceMetrics))
                .trainingSamples(trainingSamples)
                .status(status)
                .artifacts(artifacts == null ? new ArrayList<>() : new ArrayList<>(artifacts))
                .dependencies(dependencies == null ? new LinkedHashMap<>() : new LinkedHashMap<>(dependencies))
                .inputSchemaVersion(inputSchemaVersion)
                .build();
    }
}
