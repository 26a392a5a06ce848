package com.chicu.mlcore.ml.error;

import java.util.Map;

public class ValidationException extends ModelException {

    public ValidationException(String message) {
        this(message, Map.of(), null);
    }

    public ValidationException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public ValidationException(String message, Map<String, ?> context, Throwable cause) {
        super(message, ErrorCode.VALIDATION_ERROR, context, cause);
    }
}
