package com.chicu.mlcore.ml.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Итог {@link ModelTestSuite}: отчёт каждой проверки по имени и общий флаг.
 */
public record SuiteReport(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("model_type") String modelType,
        @JsonProperty("tests") Map<String, VerificationReport> tests,
        @JsonProperty("all_passed") boolean allPassed
) {

    public SuiteReport {
        tests = tests == null ? Map.of() : Map.copyOf(tests);
    }
}
