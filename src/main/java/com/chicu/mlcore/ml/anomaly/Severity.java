package com.chicu.mlcore.ml.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * По отношению score / threshold: &gt;2 critical, &gt;1.5 high, &gt;1 medium, иначе low.
     */
    public static Severity fromRatio(double ratio) {
        if (ratio > 2.0) return CRITICAL;
        if (ratio > 1.5) return HIGH;
        if (ratio > 1.0) return MEDIUM;
        return LOW;
    }
}
