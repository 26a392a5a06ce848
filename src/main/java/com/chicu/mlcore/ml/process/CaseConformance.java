package com.chicu.mlcore.ml.process;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param fitness    1 - deviations / (переходов + 2); 1.0 — трасса целиком укладывается в граф
 * @param deviations "start:X", "X->Y", "end:Y"
 */
public record CaseConformance(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("trace_length") int traceLength,
        @JsonProperty("fitness") double fitness,
        @JsonProperty("is_conforming") boolean conforming,
        @JsonProperty("deviations") List<String> deviations
) {

    public CaseConformance {
        deviations = deviations == null ? List.of() : List.copyOf(deviations);
    }
}
