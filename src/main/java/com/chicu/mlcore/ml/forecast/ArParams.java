package com.chicu.mlcore.ml.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param residualStd σ остатков в нормализованных единицах
 */
public record ArParams(
        @JsonProperty("lags") int lags,
        @JsonProperty("horizon") int horizon,
        @JsonProperty("residual_std") double residualStd
) {
}
