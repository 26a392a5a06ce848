package com.chicu.mlcore.ml.process;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MinerParams(
        @JsonProperty("min_edge_count") long minEdgeCount,
        @JsonProperty("fitness_threshold") double fitnessThreshold
) {
}
