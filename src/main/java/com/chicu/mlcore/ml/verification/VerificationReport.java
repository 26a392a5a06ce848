package com.chicu.mlcore.ml.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param error код и сообщение ошибки, если проверка не дошла до сравнения
 */
public record VerificationReport(
        @JsonProperty("passed") boolean passed,
        @JsonProperty("original_predictions") int originalPredictions,
        @JsonProperty("loaded_predictions") int loadedPredictions,
        @JsonProperty("mismatches") List<String> mismatches,
        @JsonProperty("save_path") String savePath,
        @JsonProperty("error") String error
) {

    public VerificationReport {
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
    }
}
