package com.chicu.mlcore.ml.core;

import java.util.List;
import java.util.Map;

/**
 * @param predictions по одной записи на входную строку/кейс/шаг горизонта
 * @param confidence  агрегированные оценки уверенности (может быть пустым)
 * @param metadata    служебные детали: тип модели, число строк и т.п.
 */
public record PredictionResult<P>(
        List<P> predictions,
        Map<String, Double> confidence,
        Map<String, Object> metadata
) {

    public PredictionResult {
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
        confidence = confidence == null ? Map.of() : confidence;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public int size() {
        return predictions.size();
    }
}
