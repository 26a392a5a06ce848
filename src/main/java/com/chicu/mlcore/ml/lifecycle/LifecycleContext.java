package com.chicu.mlcore.ml.lifecycle;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Неизменяемый контекст, который получает каждый хук.
 * payload — произвольные детали операции (число строк, путь сохранения, ошибка).
 */
public record LifecycleContext(
        String modelId,
        String modelType,
        LifecycleOperation operation,
        Instant timestamp,
        Map<String, Object> payload
) {

    public LifecycleContext {
        payload = payload == null || payload.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static LifecycleContext of(String modelId, String modelType, LifecycleOperation operation) {
        return new LifecycleContext(modelId, modelType, operation, Instant.now(), Map.of());
    }

    /** Новый контекст с дополненным payload; исходный не меняется. */
    public LifecycleContext with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(payload);
        next.put(key, value);
        return new LifecycleContext(modelId, modelType, operation, timestamp, next);
    }
}
