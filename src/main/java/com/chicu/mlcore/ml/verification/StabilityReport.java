package com.chicu.mlcore.ml.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StabilityReport(
        @JsonProperty("passed") boolean passed,
        @JsonProperty("avg_similarity") double avgSimilarity,
        @JsonProperty("n_runs") int runs,
        @JsonProperty("successful_runs") int successfulRuns,
        @JsonProperty("error") String error
) {
}
