package com.chicu.mlcore.ml.anomaly;

import com.chicu.mlcore.ml.core.ModelBase;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Общее для детекторов аномалий: contamination, фильтр аномалий и
 * оценка по разметке (1 — аномалия, 0 — норма).
 */
public abstract class AnomalyDetectorBase<I> extends ModelBase<I, AnomalyRecord, int[]> {

    private final double contamination;

    protected AnomalyDetectorBase(ModelRuntime runtime,
                                  String modelId,
                                  String modelType,
                                  String version,
                                  double contamination) {
        super(runtime, modelId, modelType, version);
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination должен быть в (0, 0.5], а пришло: " + contamination);
        }
        this.contamination = contamination;
        hyperparameter("contamination", contamination);
    }

    public double getContamination() {
        return contamination;
    }

    /** Только аномальные записи. */
    public List<AnomalyRecord> detectAnomalies(I data) {
        return predict(data).predictions().stream()
                .filter(AnomalyRecord::anomaly)
                .toList();
    }

    /**
     * accuracy / precision / recall / f1_score + матрица ошибок.
     * Метрики дописываются в манифест.
     */
    @Override
    public Map<String, Double> evaluate(I data, int[] labels) {
        if (labels == null) {
            throw new ValidationException("labels=null", Map.of("model_id", getModelId()));
        }
        List<AnomalyRecord> predictions = predict(data).predictions();
        if (predictions.size() != labels.length) {
            throw new ValidationException(
                    "Число меток не совпадает с числом предсказаний",
                    Map.of("predictions", predictions.size(), "labels", labels.length)
            );
        }

        int tp = 0, fp = 0, tn = 0, fn = 0;
        for (int i = 0; i < labels.length; i++) {
            boolean predicted = predictions.get(i).anomaly();
            boolean actual = labels[i] == 1;
            if (predicted && actual) tp++;
            else if (predicted) fp++;
            else if (actual) fn++;
            else tn++;
        }

        int total = labels.length;
        double accuracy = total > 0 ? (double) (tp + tn) / total : 0.0;
        double precision = (tp + fp) > 0 ? (double) tp / (tp + fp) : 0.0;
        double recall = (tp + fn) > 0 ? (double) tp / (tp + fn) : 0.0;
        double f1 = (precision + recall) > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("accuracy", accuracy);
        metrics.put("precision", precision);
        metrics.put("recall", recall);
        metrics.put("f1_score", f1);
        metrics.put("true_positives", (double) tp);
        metrics.put("false_positives", (double) fp);
        metrics.put("true_negatives", (double) tn);
        metrics.put("false_negatives", (double) fn);

        recordMetrics(metrics);
        return metrics;
    }
}
