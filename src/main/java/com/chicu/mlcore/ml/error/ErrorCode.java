package com.chicu.mlcore.ml.error;

/**
 * Закрытый набор кодов ошибок. Вызывающий код ветвится по коду, а не по тексту сообщения.
 */
public enum ErrorCode {
    TRAINING_FAILED,
    PREDICTION_FAILED,
    VALIDATION_ERROR,
    PERSISTENCE_ERROR,
    LIFECYCLE_ERROR,
    INCOMPATIBLE_VERSION,
    MISSING_ARTIFACT,
    CHECKSUM_MISMATCH
}
