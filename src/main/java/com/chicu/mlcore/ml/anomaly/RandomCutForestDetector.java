package com.chicu.mlcore.ml.anomaly;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.core.PredictionResult;
import com.chicu.mlcore.ml.features.EventRecord;
import com.chicu.mlcore.ml.features.FeatureConfig;
import com.chicu.mlcore.ml.features.FeatureExtractor;
import com.chicu.mlcore.ml.error.PredictionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Детектор на Random Cut Forest поверх журнала событий.
 * <p>
 * Событие → вектор через {@link FeatureExtractor} (обучается вместе с лесом и сохраняется рядом).
 * Порог = квантиль обучающих score уровня (1 - contamination); score выше порога → аномалия.
 * <p>
 * Артефакты: forest (NATIVE, RandomCutForestState), feature_extractor (JSON), threshold (JSON).
 */
@Slf4j
public class RandomCutForestDetector extends AnomalyDetectorBase<List<EventRecord>> {

    public static final String MODEL_TYPE = "random_cut_forest";

    static final int MIN_SAMPLES = 10;

    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;

    private RandomCutForest forest;
    private FeatureExtractor featureExtractor;
    private double threshold;

    public RandomCutForestDetector(ModelRuntime runtime, String modelId, String version,
                                   int numberOfTrees, int sampleSize, double contamination,
                                   long randomSeed, FeatureConfig featureConfig) {
        super(runtime, modelId, MODEL_TYPE, version, contamination);
        if (numberOfTrees < 1) throw new IllegalArgumentException("numberOfTrees должен быть >= 1");
        if (sampleSize < MIN_SAMPLES) throw new IllegalArgumentException("sampleSize должен быть >= " + MIN_SAMPLES);

        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
        this.featureExtractor = new FeatureExtractor(featureConfig);

        hyperparameter("number_of_trees", numberOfTrees);
        hyperparameter("sample_size", sampleSize);
        hyperparameter("random_seed", randomSeed);
        dependency("randomcutforest-core", libraryVersion(RandomCutForest.class));

        registerArtifact("forest", "forest.ser", ArtifactType.NATIVE, RandomCutForestState.class,
                () -> forest == null ? null : mapper().toState(forest),
                (RandomCutForestState state) -> mapper().toModel(state),
                (RandomCutForest restored) -> forest = restored);
        registerArtifact("feature_extractor", "feature_extractor.json", ArtifactType.JSON, FeatureExtractor.class,
                () -> featureExtractor, v -> featureExtractor = v);
        registerArtifact("threshold", "threshold.json", ArtifactType.JSON, ThresholdArtifact.class,
                () -> new ThresholdArtifact(threshold), v -> threshold = v.threshold());
    }

    public RandomCutForestDetector(ModelRuntime runtime, String modelId) {
        this(runtime, modelId, "1.0.0", 100, 256, 0.05, 42L, FeatureConfig.defaults());
    }

    @Override
    protected int minTrainingSamples() {
        return MIN_SAMPLES;
    }

    @Override
    protected int sampleCount(List<EventRecord> data) {
        return data.size();
    }

    @Override
    protected List<String> requiredDependencies() {
        return List.of("com.amazon.randomcutforest.RandomCutForest");
    }

    @Override
    protected String inputSchemaVersion() {
        return featureExtractor.isFitted() ? featureExtractor.getSchema().schemaHash() : null;
    }

    @Override
    protected Map<String, Double> fit(List<EventRecord> events) {
        double[][] x = featureExtractor.fitTransform(events);

        RandomCutForest f = RandomCutForest.builder()
                .dimensions(x[0].length)
                .numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize)
                .randomSeed(randomSeed)
                .outputAfter(1)
                .build();
        for (double[] row : x) {
            f.update(row);
        }

        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scores[i] = f.getAnomalyScore(x[i]);
        }

        this.forest = f;
        this.threshold = quantile(scores, 1.0 - getContamination());

        int anomalies = 0;
        for (double s : scores) if (s > threshold) anomalies++;

        log.info("🌲 RCF fit modelId={} samples={} dims={} threshold={} anomalies={}",
                getModelId(), x.length, x[0].length, threshold, anomalies);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("anomalies_in_training", (double) anomalies);
        metrics.put("anomaly_rate", (double) anomalies / x.length);
        metrics.put("threshold", threshold);
        return metrics;
    }

    @Override
    protected PredictionResult<AnomalyRecord> infer(List<EventRecord> events) {
        double[][] x = featureExtractor.transform(events);
        if (x.length > 0 && x[0].length != forest.getDimensions()) {
            throw new PredictionException(
                    "Размерность признаков " + x[0].length + " не совпадает с лесом " + forest.getDimensions(),
                    Map.of("model_id", getModelId())
            );
        }

        List<AnomalyRecord> out = new ArrayList<>(x.length);
        Map<String, Double> confidence = new LinkedHashMap<>();
        int anomalies = 0;

        for (int i = 0; i < x.length; i++) {
            double score = forest.getAnomalyScore(x[i]);
            boolean anomaly = score > threshold;
            if (anomaly) anomalies++;

            double conf = threshold != 0.0 ? Math.abs(score - threshold) / Math.abs(threshold) : 1.0;
            Severity severity = threshold != 0.0 ? Severity.fromRatio(Math.abs(score) / Math.abs(threshold)) : Severity.LOW;

            out.add(new AnomalyRecord(i, anomaly, score, severity, null, conf, events.get(i).caseId()));
            confidence.put(String.valueOf(i), conf);
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model_type", MODEL_TYPE);
        meta.put("total_samples", out.size());
        meta.put("anomalies_detected", anomalies);
        meta.put("threshold", threshold);
        return new PredictionResult<>(out, confidence, meta);
    }

    public double getThreshold() {
        return threshold;
    }

    public FeatureExtractor getFeatureExtractor() {
        return featureExtractor;
    }

    private static RandomCutForestMapper mapper() {
        RandomCutForestMapper m = new RandomCutForestMapper();
        m.setSaveExecutorContextEnabled(true);
        m.setSaveTreeStateEnabled(true);
        return m;
    }

    /** Квантиль с линейной интерполяцией между соседними порядковыми статистиками. */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (sorted.length == 1) return sorted[0];
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }
}
