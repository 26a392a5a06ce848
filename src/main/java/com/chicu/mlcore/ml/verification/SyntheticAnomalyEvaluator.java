package com.chicu.mlcore.ml.verification;

import com.chicu.mlcore.ml.anomaly.AnomalyDetectorBase;
import com.chicu.mlcore.ml.error.ValidationException;
import com.chicu.mlcore.ml.features.StandardScaler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Оценка обученного детектора без ручной разметки.
 * <p>
 * Первые round(n·rate) строк "нормальных" данных портятся гауссовым шумом с σ = 3·std колонки
 * и помечаются 1, остальные 0; выборка перемешивается и уходит в {@link AnomalyDetectorBase#evaluate}.
 * Один и тот же seed даёт одну и ту же выборку.
 */
@Slf4j
public final class SyntheticAnomalyEvaluator {

    public static final double DEFAULT_CONTAMINATION_RATE = 0.1;
    public static final double NOISE_SIGMAS = 3.0;

    private SyntheticAnomalyEvaluator() {
    }

    public static Map<String, Double> evaluate(AnomalyDetectorBase<double[][]> detector,
                                               double[][] normalData,
                                               long seed) {
        return evaluate(detector, normalData, DEFAULT_CONTAMINATION_RATE, seed);
    }

    public static Map<String, Double> evaluate(AnomalyDetectorBase<double[][]> detector,
                                               double[][] normalData,
                                               double contaminationRate,
                                               long seed) {
        if (normalData == null || normalData.length == 0) {
            throw new ValidationException("normalData пустые", Map.of("model_id", detector.getModelId()));
        }
        if (!(contaminationRate > 0.0 && contaminationRate < 1.0)) {
            throw new ValidationException(
                    "contamination_rate должен быть в (0, 1): " + contaminationRate,
                    Map.of("contamination_rate", contaminationRate)
            );
        }

        int rows = normalData.length;
        int anomalies = (int) (rows * contaminationRate);
        double[] std = new StandardScaler().fit(normalData).getStd();
        Random rnd = new Random(seed);

        // нормальные строки, затем испорченные: как в выборке до перемешивания
        List<double[]> samples = new ArrayList<>(rows);
        List<Integer> labels = new ArrayList<>(rows);
        for (int i = anomalies; i < rows; i++) {
            samples.add(normalData[i].clone());
            labels.add(0);
        }
        for (int i = 0; i < anomalies; i++) {
            double[] row = normalData[i].clone();
            for (int j = 0; j < row.length; j++) {
                row[j] += rnd.nextGaussian() * NOISE_SIGMAS * std[j];
            }
            samples.add(row);
            labels.add(1);
        }

        List<Integer> order = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) order.add(i);
        Collections.shuffle(order, rnd);

        double[][] testData = new double[rows][];
        int[] testLabels = new int[rows];
        for (int i = 0; i < rows; i++) {
            testData[i] = samples.get(order.get(i));
            testLabels[i] = labels.get(order.get(i));
        }

        Map<String, Double> metrics = detector.evaluate(testData, testLabels);
        log.info("🧪 Synthetic anomalies modelId={} rows={} injected={} f1={}",
                detector.getModelId(), rows, anomalies, metrics.get("f1_score"));
        return metrics;
    }
}
