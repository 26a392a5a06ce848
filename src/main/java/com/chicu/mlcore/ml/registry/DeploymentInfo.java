package com.chicu.mlcore.ml.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DeploymentInfo(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("version") String version,
        @JsonProperty("deployed_at") Instant deployedAt,
        @JsonProperty("model_path") String modelPath
) {
}
