package com.chicu.mlcore.ml.error;

import java.util.Map;

public class LifecycleException extends ModelException {

    public LifecycleException(String message) {
        this(message, Map.of(), null);
    }

    public LifecycleException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public LifecycleException(String message, Map<String, ?> context, Throwable cause) {
        super(message, ErrorCode.LIFECYCLE_ERROR, context, cause);
    }
}
