package com.chicu.mlcore.ml.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

/** params.json у DBSCAN-детектора */
public record DbscanParams(
        @JsonProperty("eps") double eps,
        @JsonProperty("min_samples") int minSamples,
        @JsonProperty("dimensions") int dimensions,
        @JsonProperty("n_clusters") int nClusters
) {
}
