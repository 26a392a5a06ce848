package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Один сохранённый blob модели. name уникален в пределах манифеста,
 * checksum — hex SHA-256 от байтов файла на момент сохранения.
 */
public record ArtifactSpec(
        @JsonProperty("name") String name,
        @JsonProperty("filename") String filename,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("size_bytes") long sizeBytes,
        @JsonProperty("artifact_type") ArtifactType artifactType
) { }
