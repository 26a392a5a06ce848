package com.chicu.mlcore.ml.core;

import com.chicu.mlcore.ml.persistence.ModelManifest;

import java.util.Map;

/**
 * Результат обучения. manifest — снимок на момент окончания train().
 */
public record TrainingResult(
        boolean success,
        Map<String, Double> metrics,
        ModelManifest manifest,
        String error
) {

    public static TrainingResult ok(Map<String, Double> metrics, ModelManifest manifest) {
        return new TrainingResult(true, metrics, manifest, null);
    }
}
