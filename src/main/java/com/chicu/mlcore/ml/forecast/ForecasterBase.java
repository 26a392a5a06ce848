package com.chicu.mlcore.ml.forecast;

import com.chicu.mlcore.ml.core.ModelBase;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.core.PredictionResult;
import com.chicu.mlcore.ml.error.PredictionException;
import com.chicu.mlcore.ml.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Прогнозные модели: вход — история ряда, предсказание — horizon шагов вперёд.
 * evaluate(history, actual) сравнивает прогноз по history с фактическими значениями.
 */
public abstract class ForecasterBase extends ModelBase<double[], ForecastPoint, double[]> {

    private final int horizon;

    protected ForecasterBase(ModelRuntime runtime, String modelId, String modelType, String version, int horizon) {
        super(runtime, modelId, modelType, version);
        if (horizon < 1) throw new IllegalArgumentException("horizon должен быть >= 1");
        this.horizon = horizon;
        hyperparameter("horizon", horizon);
    }

    public int getHorizon() {
        return horizon;
    }

    /** Прогноз на произвольный горизонт, без хуков predict. */
    public final List<ForecastPoint> forecast(double[] history, int steps) {
        if (!isTrained()) {
            throw new PredictionException("Модель не обучена", Map.of("model_id", getModelId()));
        }
        if (steps < 1) {
            throw new ValidationException("steps должен быть >= 1", Map.of("steps", steps));
        }
        return forecastSteps(history, steps);
    }

    protected abstract List<ForecastPoint> forecastSteps(double[] history, int steps);

    @Override
    protected PredictionResult<ForecastPoint> infer(double[] history) {
        List<ForecastPoint> points = forecastSteps(history, horizon);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model_type", getModelType());
        meta.put("horizon", horizon);
        meta.put("history_length", history.length);
        return new PredictionResult<>(points, Map.of(), meta);
    }

    /**
     * mae, rmse, mape (%). Пары берутся по min(длина прогноза, длина actual);
     * нули в actual в mape пропускаются, делитель — длина actual.
     */
    @Override
    public Map<String, Double> evaluate(double[] history, double[] actual) {
        if (actual == null) {
            throw new ValidationException("actual=null", Map.of("model_id", getModelId()));
        }
        List<ForecastPoint> predicted = predict(history).predictions();
        int n = Math.min(predicted.size(), actual.length);

        double absSum = 0, sqSum = 0, pctSum = 0;
        for (int i = 0; i < n; i++) {
            double p = predicted.get(i).value();
            double l = actual[i];
            double err = Math.abs(p - l);
            absSum += err;
            sqSum += err * err;
            if (l != 0.0) pctSum += err / Math.abs(l);
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("mae", n > 0 ? absSum / n : 0.0);
        metrics.put("rmse", n > 0 ? Math.sqrt(sqSum / n) : 0.0);
        metrics.put("mape", actual.length > 0 ? pctSum / actual.length * 100.0 : 0.0);

        recordMetrics(metrics);
        return metrics;
    }
}
