package com.chicu.mlcore.ml.forecast;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.error.PredictionException;
import com.chicu.mlcore.ml.features.StandardScaler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AR(p): z[t] = b0 + b1*z[t-1] + ... + bp*z[t-p], коэффициенты — OLS (Apache Commons Math)
 * по нормализованному ряду. Прогноз рекурсивный, интервал ±1.96·σ·√h.
 * <p>
 * Артефакты: coefficients (BINARY), scaler (JSON), params (JSON).
 */
@Slf4j
public class AutoRegressiveForecaster extends ForecasterBase {

    public static final String MODEL_TYPE = "autoregressive";

    private static final double Z_95 = 1.96;

    private int lags;

    private double[] coefficients;
    private StandardScaler scaler;
    private double residualStd;

    public AutoRegressiveForecaster(ModelRuntime runtime, String modelId, String version, int lags, int horizon) {
        super(runtime, modelId, MODEL_TYPE, version, horizon);
        if (lags < 1) throw new IllegalArgumentException("lags должен быть >= 1");
        this.lags = lags;

        hyperparameter("lags", lags);
        dependency("commons-math3", libraryVersion(OLSMultipleLinearRegression.class));

        registerArtifact("coefficients", "coefficients.bin", ArtifactType.BINARY, double[].class,
                () -> coefficients, v -> coefficients = v);
        registerArtifact("scaler", "scaler.json", ArtifactType.JSON, StandardScaler.class,
                () -> scaler, v -> scaler = v);
        registerArtifact("params", "params.json", ArtifactType.JSON, ArParams.class,
                () -> new ArParams(this.lags, getHorizon(), residualStd),
                p -> {
                    this.lags = p.lags();
                    this.residualStd = p.residualStd();
                });
    }

    public AutoRegressiveForecaster(ModelRuntime runtime, String modelId) {
        this(runtime, modelId, "1.0.0", 3, 7);
    }

    @Override
    protected int minTrainingSamples() {
        return 2 * lags + 10;
    }

    @Override
    protected int sampleCount(double[] data) {
        return data.length;
    }

    @Override
    protected List<String> requiredDependencies() {
        return List.of("org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression");
    }

    @Override
    protected Map<String, Double> fit(double[] data) {
        double[] series = SeriesPreprocessor.clean(data);

        StandardScaler s = new StandardScaler().fit(series);
        double[] z = s.transform(series);

        int rows = z.length - lags;
        double[] y = new double[rows];
        double[][] x = new double[rows][lags];
        for (int t = lags; t < z.length; t++) {
            y[t - lags] = z[t];
            for (int k = 0; k < lags; k++) {
                x[t - lags][k] = z[t - 1 - k];
            }
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(y, x);
        double[] beta = ols.estimateRegressionParameters();
        double[] residuals = ols.estimateResiduals();

        double sq = 0, abs = 0;
        for (double r : residuals) {
            sq += r * r;
            abs += Math.abs(r);
        }
        double sigma = Math.sqrt(sq / residuals.length);
        double scale = s.getStd()[0];

        this.scaler = s;
        this.coefficients = beta;
        this.residualStd = sigma;

        log.info("📈 AR fit modelId={} lags={} samples={} sigma={}", getModelId(), lags, series.length, sigma);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("in_sample_mae", abs / residuals.length * scale);
        metrics.put("in_sample_rmse", sigma * scale);
        metrics.put("r_squared", ols.calculateRSquared());
        metrics.put("residual_std", sigma);
        return metrics;
    }

    @Override
    protected List<ForecastPoint> forecastSteps(double[] history, int steps) {
        double[] series = SeriesPreprocessor.clean(history);
        if (series.length < lags) {
            throw new PredictionException(
                    "История короче числа лагов: " + series.length + " < " + lags,
                    Map.of("model_id", getModelId(), "history", series.length, "lags", lags)
            );
        }

        // window[0] — самое свежее значение
        double[] window = new double[lags];
        for (int k = 0; k < lags; k++) {
            window[k] = scaler.scale(series[series.length - 1 - k], 0);
        }

        List<ForecastPoint> out = new ArrayList<>(steps);
        for (int h = 1; h <= steps; h++) {
            double next = coefficients[0];
            for (int k = 0; k < lags; k++) {
                next += coefficients[k + 1] * window[k];
            }

            double half = Z_95 * residualStd * Math.sqrt(h);
            out.add(new ForecastPoint(
                    h,
                    scaler.unscale(next, 0),
                    scaler.unscale(next - half, 0),
                    scaler.unscale(next + half, 0)
            ));

            System.arraycopy(window, 0, window, 1, lags - 1);
            window[0] = next;
        }
        return out;
    }

    public int getLags() {
        return lags;
    }

    public double[] getCoefficients() {
        return coefficients == null ? null : coefficients.clone();
    }
}
