package com.chicu.mlcore.ml.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Один шаг прогноза с 95% интервалом.
 *
 * @param step 1..horizon
 */
public record ForecastPoint(
        @JsonProperty("step") int step,
        @JsonProperty("value") double value,
        @JsonProperty("lower") double lower,
        @JsonProperty("upper") double upper
) {
}
