package com.chicu.mlcore.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Стратегия сериализации артефакта.
 * NATIVE  — Java-сериализация объекта (Serializable)
 * TABULAR — double[][] в CSV
 * JSON    — Jackson
 * BINARY  — double[] как big-endian IEEE-754 (веса)
 */
public enum ArtifactType {
    NATIVE,
    TABULAR,
    JSON,
    BINARY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ArtifactType fromWire(String value) {
        if (value == null) return null;
        return ArtifactType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
