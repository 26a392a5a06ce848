package com.chicu.mlcore.ml.forecast;

import com.chicu.mlcore.ml.error.ModelException;
import com.chicu.mlcore.ml.error.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rolling-window backtest: окно обучения сдвигается на horizon, каждая сплит-модель
 * новая, прогноз сравнивается со следующими horizon точками.
 * <p>
 * Ошибка одного сплита не прерывает прогон, а попадает в errors.
 */
@Slf4j
public final class RollingBacktest {

    private static final double MAPE_EPS = 1e-10;

    private RollingBacktest() {
    }

    /**
     * @param factory модель по model_id ("backtest_&lt;i&gt;")
     */
    public static BacktestReport run(Function<String, ? extends ForecasterBase> factory,
                                     double[] data,
                                     int windowSize,
                                     int horizon,
                                     int nSplits) {
        if (data == null || windowSize < 1 || horizon < 1 || nSplits < 1) {
            throw new ValidationException("Некорректные параметры backtest",
                    Map.of("window_size", windowSize, "horizon", horizon, "n_splits", nSplits));
        }
        if (data.length < windowSize + horizon * nSplits) {
            throw new ValidationException(
                    "Недостаточно данных для backtest: " + data.length + " < " + (windowSize + horizon * nSplits),
                    Map.of("length", data.length, "required", windowSize + horizon * nSplits)
            );
        }

        List<Double> predictions = new ArrayList<>();
        List<Double> actuals = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < nSplits; i++) {
            int start = i * horizon;
            int trainEnd = start + windowSize;
            int testEnd = trainEnd + horizon;

            double[] train = Arrays.copyOfRange(data, start, trainEnd);
            double[] test = Arrays.copyOfRange(data, trainEnd, testEnd);

            try {
                ForecasterBase model = factory.apply("backtest_" + i);
                model.train(train);
                List<ForecastPoint> forecast = model.forecast(train, test.length);
                for (int k = 0; k < test.length; k++) {
                    predictions.add(forecast.get(k).value());
                    actuals.add(test[k]);
                }
            } catch (ModelException e) {
                log.warn("⚠️ Backtest split {} failed: {}", i, e.toString());
                errors.add("Split " + i + ": " + e.getMessage());
            }
        }

        if (predictions.isEmpty()) {
            List<String> all = new ArrayList<>(errors);
            all.add("No successful predictions");
            return new BacktestReport(false, nSplits, 0, Map.of(), all);
        }

        double abs = 0, sq = 0, pct = 0;
        for (int k = 0; k < predictions.size(); k++) {
            double d = predictions.get(k) - actuals.get(k);
            abs += Math.abs(d);
            sq += d * d;
            pct += Math.abs(d / (actuals.get(k) + MAPE_EPS));
        }
        int n = predictions.size();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("mae", abs / n);
        metrics.put("rmse", Math.sqrt(sq / n));
        metrics.put("mape", pct / n * 100.0);

        log.info("🧪 Backtest done splits={} ok={} mae={}", nSplits, nSplits - errors.size(), metrics.get("mae"));

        return new BacktestReport(errors.isEmpty(), nSplits, nSplits - errors.size(), metrics, errors);
    }
}
