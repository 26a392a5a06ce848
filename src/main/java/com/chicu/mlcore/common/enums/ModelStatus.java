package com.chicu.mlcore.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Статус модели в манифесте */
public enum ModelStatus {
    INITIALIZED,
    TRAINING,
    TRAINED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ModelStatus fromWire(String value) {
        if (value == null) return null;
        return ModelStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
