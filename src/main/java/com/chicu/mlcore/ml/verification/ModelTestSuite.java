package com.chicu.mlcore.ml.verification;

import com.chicu.mlcore.ml.core.ModelBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Набор проверок одной модели. Сейчас одна проверка, "persistence", и она
 * выполняется только при наличии тестовых данных.
 * all_passed = все выполненные проверки прошли; без проверок это true.
 */
@Slf4j
@RequiredArgsConstructor
public class ModelTestSuite {

    public static final String PERSISTENCE = "persistence";

    private final PersistenceVerifier persistenceVerifier;

    public <I, P> SuiteReport runAll(ModelBase<I, P, ?> model,
                                     Supplier<? extends ModelBase<I, P, ?>> freshInstance,
                                     I testData,
                                     Path directory) {
        Map<String, VerificationReport> results = new LinkedHashMap<>();
        if (testData != null) {
            results.put(PERSISTENCE, persistenceVerifier.verify(model, freshInstance, testData, directory));
        }

        boolean allPassed = results.values().stream().allMatch(VerificationReport::passed);
        log.info("{} Test suite modelId={} type={} tests={}",
                allPassed ? "✅" : "❌", model.getModelId(), model.getModelType(), results.keySet());

        return new SuiteReport(model.getModelId(), model.getModelType(), results, allPassed);
    }
}
