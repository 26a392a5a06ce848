package com.chicu.mlcore.ml.forecast;

import com.chicu.mlcore.ml.error.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Подготовка временного ряда перед обучением.
 */
public final class SeriesPreprocessor {

    private SeriesPreprocessor() {
    }

    /**
     * Заполнить NaN. forward/backward оставляют NaN на краю, если заполнять нечем.
     */
    public static double[] fillMissing(double[] values, FillMethod method) {
        double[] out = values.clone();
        switch (method) {
            case FORWARD_FILL -> {
                for (int i = 1; i < out.length; i++) {
                    if (Double.isNaN(out[i])) out[i] = out[i - 1];
                }
            }
            case BACKWARD_FILL -> {
                for (int i = out.length - 2; i >= 0; i--) {
                    if (Double.isNaN(out[i])) out[i] = out[i + 1];
                }
            }
            case MEAN -> {
                double sum = 0;
                int n = 0;
                for (double v : out) {
                    if (!Double.isNaN(v)) {
                        sum += v;
                        n++;
                    }
                }
                double mean = n > 0 ? sum / n : Double.NaN;
                for (int i = 0; i < out.length; i++) {
                    if (Double.isNaN(out[i])) out[i] = mean;
                }
            }
            case ZERO -> {
                for (int i = 0; i < out.length; i++) {
                    if (Double.isNaN(out[i])) out[i] = 0.0;
                }
            }
        }
        return out;
    }

    /**
     * forward-fill, затем backward-fill для ведущих пропусков.
     * Ряд, в котором не осталось ни одного числа, не принимается.
     */
    public static double[] clean(double[] values) {
        if (values == null) throw new ValidationException("series=null");
        double[] out = fillMissing(fillMissing(values, FillMethod.FORWARD_FILL), FillMethod.BACKWARD_FILL);
        for (int i = 0; i < out.length; i++) {
            if (!Double.isFinite(out[i])) {
                throw new ValidationException(
                        "Ряд содержит нечисловое значение на позиции " + i,
                        Map.of("index", i)
                );
            }
        }
        return out;
    }

    /**
     * Сортирует пары (время, значение) по времени. Сортировка устойчивая:
     * при равных метках сохраняется исходный порядок значений.
     */
    public static TimestampedSeries validateTimestamps(List<Instant> timestamps, double[] values) {
        if (timestamps == null || values == null) {
            throw new ValidationException("timestamps/values=null");
        }
        if (timestamps.size() != values.length) {
            throw new ValidationException(
                    "Timestamps (" + timestamps.size() + ") и values (" + values.length + ") разной длины",
                    Map.of("timestamps", timestamps.size(), "values", values.length)
            );
        }
        for (int i = 0; i < timestamps.size(); i++) {
            if (timestamps.get(i) == null) {
                throw new ValidationException("Пустая метка времени на позиции " + i, Map.of("index", i));
            }
        }

        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparing((Integer i) -> timestamps.get(i)));

        List<Instant> sortedTs = new ArrayList<>(order.length);
        double[] sortedValues = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            sortedTs.add(timestamps.get(order[i]));
            sortedValues[i] = values[order[i]];
        }
        return new TimestampedSeries(sortedTs, sortedValues);
    }
}
