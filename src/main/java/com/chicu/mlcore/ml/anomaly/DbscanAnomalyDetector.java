package com.chicu.mlcore.ml.anomaly;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.core.PredictionResult;
import com.chicu.mlcore.ml.dataset.TrainingDatasetBuilder;
import com.chicu.mlcore.ml.error.PredictionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.distance.EuclideanDistance;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DBSCAN-детектор (Apache Commons Math).
 * <p>
 * Обучение: кластеризация, шум (-1) = аномалии обучающей выборки.
 * Предсказание не перекластеризует вход: строка нормальна, если в радиусе eps
 * есть core point из обучения; иначе аномалия. Так результат зависит только
 * от сохранённого состояния и не меняется от вызова к вызову.
 * <p>
 * Артефакты: core_points (TABULAR), core_clusters (BINARY), params (JSON).
 */
@Slf4j
public class DbscanAnomalyDetector extends AnomalyDetectorBase<double[][]> {

    public static final String MODEL_TYPE = "dbscan";

    private static final String DBSCAN_CLASS = "org.apache.commons.math3.ml.clustering.DBSCANClusterer";
    private static final EuclideanDistance DISTANCE = new EuclideanDistance();

    private double eps;
    private int minSamples;

    private double[][] corePoints;
    private double[] coreClusters;
    private int nClusters;

    public DbscanAnomalyDetector(ModelRuntime runtime, String modelId, String version,
                                 double eps, int minSamples, double contamination) {
        super(runtime, modelId, MODEL_TYPE, version, contamination);
        if (!(eps > 0.0)) throw new IllegalArgumentException("eps должен быть > 0");
        if (minSamples < 1) throw new IllegalArgumentException("minSamples должен быть >= 1");

        this.eps = eps;
        this.minSamples = minSamples;

        hyperparameter("eps", eps);
        hyperparameter("min_samples", minSamples);
        dependency("commons-math3", libraryVersion(DBSCANClusterer.class));

        registerArtifact("core_points", "core_points.csv", ArtifactType.TABULAR, double[][].class,
                () -> corePoints, v -> corePoints = v);
        registerArtifact("core_clusters", "core_clusters.bin", ArtifactType.BINARY, double[].class,
                () -> coreClusters, v -> coreClusters = v);
        registerArtifact("params", "params.json", ArtifactType.JSON, DbscanParams.class,
                () -> new DbscanParams(this.eps, this.minSamples, dimensions(), nClusters),
                this::restoreParams);
    }

    public DbscanAnomalyDetector(ModelRuntime runtime, String modelId) {
        this(runtime, modelId, "1.0.0", 0.5, 5, 0.05);
    }

    @Override
    protected int minTrainingSamples() {
        return minSamples;
    }

    @Override
    protected int sampleCount(double[][] data) {
        return data.length;
    }

    @Override
    protected List<String> requiredDependencies() {
        return List.of(DBSCAN_CLASS);
    }

    @Override
    protected Map<String, Double> fit(double[][] data) {
        double[][] x = TrainingDatasetBuilder.checkMatrix(data);

        List<DoublePoint> points = new ArrayList<>(x.length);
        for (double[] row : x) points.add(new DoublePoint(row));

        // commons-math не считает саму точку соседом, sklearn считает
        DBSCANClusterer<DoublePoint> clusterer = new DBSCANClusterer<>(eps, minSamples - 1, DISTANCE);
        List<Cluster<DoublePoint>> clusters = clusterer.cluster(points);

        // DoublePoint сравнивается по значению: дубликаты получают метку своего оригинала
        Map<DoublePoint, Integer> labelOf = new HashMap<>();
        for (int c = 0; c < clusters.size(); c++) {
            for (DoublePoint p : clusters.get(c).getPoints()) {
                labelOf.put(p, c);
            }
        }

        List<double[]> cores = new ArrayList<>();
        List<Integer> coreLabels = new ArrayList<>();
        int noise = 0;

        for (int i = 0; i < x.length; i++) {
            Integer label = labelOf.get(points.get(i));
            if (label == null) {
                noise++;
                continue;
            }
            if (neighbours(x, i) >= minSamples) {
                cores.add(x[i]);
                coreLabels.add(label);
            }
        }

        this.corePoints = cores.toArray(new double[0][]);
        this.coreClusters = new double[coreLabels.size()];
        for (int i = 0; i < coreLabels.size(); i++) coreClusters[i] = coreLabels.get(i);
        this.nClusters = clusters.size();

        log.info("🔎 DBSCAN fit modelId={} samples={} clusters={} noise={} corePoints={}",
                getModelId(), x.length, nClusters, noise, corePoints.length);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("anomalies_detected", (double) noise);
        metrics.put("anomaly_rate", (double) noise / x.length);
        metrics.put("n_clusters", (double) nClusters);
        return metrics;
    }

    @Override
    protected PredictionResult<AnomalyRecord> infer(double[][] data) {
        double[][] x = TrainingDatasetBuilder.checkMatrix(data);
        int dims = dimensions();
        if (x.length > 0 && dims > 0 && x[0].length != dims) {
            throw new PredictionException(
                    "Размерность входа " + x[0].length + " не совпадает с обучением " + dims,
                    Map.of("model_id", getModelId(), "expected", dims, "actual", x[0].length)
            );
        }

        List<AnomalyRecord> out = new ArrayList<>(x.length);
        int anomalies = 0;
        for (int i = 0; i < x.length; i++) {
            int nearest = nearestCore(x[i]);
            boolean anomaly = nearest < 0;
            if (anomaly) anomalies++;
            out.add(new AnomalyRecord(
                    i,
                    anomaly,
                    anomaly ? 1.0 : 0.0,
                    anomaly ? Severity.HIGH : Severity.LOW,
                    anomaly ? null : (int) coreClusters[nearest],
                    null,
                    null
            ));
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model_type", MODEL_TYPE);
        meta.put("total_samples", out.size());
        meta.put("anomalies_detected", anomalies);
        return new PredictionResult<>(out, Map.of(), meta);
    }

    public double getEps() {
        return eps;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public int getClusterCount() {
        return nClusters;
    }

    /** Индекс ближайшего core point в радиусе eps или -1. */
    private int nearestCore(double[] row) {
        int best = -1;
        double bestDist = Double.MAX_VALUE;
        for (int k = 0; k < corePoints.length; k++) {
            double d = DISTANCE.compute(row, corePoints[k]);
            if (d <= eps && d < bestDist) {
                best = k;
                bestDist = d;
            }
        }
        return best;
    }

    /** Число точек в радиусе eps, включая саму точку. */
    private int neighbours(double[][] x, int i) {
        int count = 0;
        for (double[] other : x) {
            if (DISTANCE.compute(x[i], other) <= eps) count++;
        }
        return count;
    }

    private int dimensions() {
        return corePoints != null && corePoints.length > 0 ? corePoints[0].length : 0;
    }

    private void restoreParams(DbscanParams p) {
        this.eps = p.eps();
        this.minSamples = p.minSamples();
        this.nClusters = p.nClusters();
    }
}
