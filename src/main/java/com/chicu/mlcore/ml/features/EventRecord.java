package com.chicu.mlcore.ml.features;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Одно событие журнала процесса.
 */
public record EventRecord(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("activity") String activity,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("resource") String resource,
        @JsonProperty("duration") Double duration,
        @JsonProperty("cost") Double cost,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public EventRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static EventRecord of(String caseId, String activity, Instant timestamp) {
        return new EventRecord(caseId, activity, timestamp, null, null, null, Map.of());
    }

    /**
     * Значение поля по имени признака; неизвестные имена ищутся в metadata.
     */
    public Object field(String name) {
        return switch (name) {
            case "case_id" -> caseId;
            case "activity" -> activity;
            case "timestamp" -> timestamp;
            case "resource" -> resource;
            case "duration" -> duration;
            case "cost" -> cost;
            default -> metadata.get(name);
        };
    }
}
