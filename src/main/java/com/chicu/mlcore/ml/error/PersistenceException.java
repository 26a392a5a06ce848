package com.chicu.mlcore.ml.error;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Ошибка слоя хранения. Код сужает причину: отсутствующий артефакт,
 * несовпадение контрольной суммы, несовместимая версия схемы манифеста.
 */
public class PersistenceException extends ModelException {

    private static final Set<ErrorCode> ALLOWED = EnumSet.of(
            ErrorCode.PERSISTENCE_ERROR,
            ErrorCode.INCOMPATIBLE_VERSION,
            ErrorCode.MISSING_ARTIFACT,
            ErrorCode.CHECKSUM_MISMATCH
    );

    public PersistenceException(String message) {
        this(message, ErrorCode.PERSISTENCE_ERROR, Map.of(), null);
    }

    public PersistenceException(String message, ErrorCode code, Map<String, ?> context) {
        this(message, code, context, null);
    }

    public PersistenceException(String message, ErrorCode code, Map<String, ?> context, Throwable cause) {
        super(message, requireAllowed(code), context, cause);
    }

    private static ErrorCode requireAllowed(ErrorCode code) {
        if (code == null || !ALLOWED.contains(code)) {
            throw new IllegalArgumentException("PersistenceException не поддерживает код " + code);
        }
        return code;
    }
}
