package com.chicu.mlcore.ml.error;

import java.util.Map;

public class PredictionException extends ModelException {

    public PredictionException(String message) {
        this(message, Map.of(), null);
    }

    public PredictionException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public PredictionException(String message, Map<String, ?> context, Throwable cause) {
        super(message, ErrorCode.PREDICTION_FAILED, context, cause);
    }
}
