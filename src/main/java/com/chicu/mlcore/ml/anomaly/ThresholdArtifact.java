package com.chicu.mlcore.ml.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ThresholdArtifact(@JsonProperty("threshold") double threshold) {
}
