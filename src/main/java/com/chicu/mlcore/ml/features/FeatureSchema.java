package com.chicu.mlcore.ml.features;

import com.chicu.mlcore.ml.persistence.Checksums;

import java.util.List;

/**
 * Упорядоченные имена признаков и sha256 от них; hash идёт в манифест как input_schema_version.
 */
public record FeatureSchema(List<String> names, String schemaHash) {

    public static FeatureSchema of(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("schema names пустые");
        }
        return new FeatureSchema(List.copyOf(names), Checksums.sha256(String.join("|", names)));
    }
}
