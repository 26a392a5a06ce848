package com.chicu.mlcore.ml.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record BacktestReport(
        @JsonProperty("passed") boolean passed,
        @JsonProperty("n_splits") int nSplits,
        @JsonProperty("successful_splits") int successfulSplits,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("errors") List<String> errors
) {

    public BacktestReport {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
