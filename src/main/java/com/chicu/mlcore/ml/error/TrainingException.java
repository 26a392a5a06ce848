package com.chicu.mlcore.ml.error;

import java.util.Map;

public class TrainingException extends ModelException {

    public TrainingException(String message) {
        this(message, Map.of(), null);
    }

    public TrainingException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public TrainingException(String message, Map<String, ?> context, Throwable cause) {
        super(message, ErrorCode.TRAINING_FAILED, context, cause);
    }
}
