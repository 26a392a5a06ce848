package com.chicu.mlcore.ml.anomaly;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Результат по одной строке входа.
 *
 * @param clusterId  только для density-based детекторов; null для шума
 * @param confidence удалённость score от порога в долях порога; null, если детектор её не считает
 * @param caseId     для входа-журнала событий
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyRecord(
        @JsonProperty("index") int index,
        @JsonProperty("is_anomaly") boolean anomaly,
        @JsonProperty("anomaly_score") double anomalyScore,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("cluster_id") Integer clusterId,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("case_id") String caseId
) {
}
