package com.chicu.mlcore.ml.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Базовая ошибка модели: сообщение + код + диагностический контекст.
 */
@Getter
public class ModelException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public ModelException(String message, ErrorCode code, Map<String, ?> context) {
        this(message, code, context, null);
    }

    public ModelException(String message, ErrorCode code, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "] " + getMessage()
                + (context.isEmpty() ? "" : " " + context);
    }
}
