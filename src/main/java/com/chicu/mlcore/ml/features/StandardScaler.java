package com.chicu.mlcore.ml.features;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Нормализация по колонкам: (x - mean) / (std + 1e-8). std — популяционное.
 */
@Getter
@NoArgsConstructor
public class StandardScaler {

    static final double EPSILON = 1e-8;

    @JsonProperty("mean")
    private double[] mean;

    @JsonProperty("std")
    private double[] std;

    @JsonProperty("is_fitted")
    private boolean fitted;

    public StandardScaler fit(double[][] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("StandardScaler: пустые данные");
        }
        int cols = data[0].length;
        double[] m = new double[cols];
        double[] s = new double[cols];

        Mean meanStat = new Mean();
        StandardDeviation stdStat = new StandardDeviation(false);
        double[] column = new double[data.length];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < data.length; i++) column[i] = data[i][j];
            m[j] = meanStat.evaluate(column);
            s[j] = stdStat.evaluate(column, m[j]);
        }

        this.mean = m;
        this.std = s;
        this.fitted = true;
        return this;
    }

    /** Для одномерного ряда: одна колонка. */
    public StandardScaler fit(double[] series) {
        double[][] col = new double[series.length][1];
        for (int i = 0; i < series.length; i++) col[i][0] = series[i];
        return fit(col);
    }

    public double[][] transform(double[][] data) {
        requireFitted();
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++) {
                out[i][j] = scale(data[i][j], j);
            }
        }
        return out;
    }

    public double[] transform(double[] series) {
        requireFitted();
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) out[i] = scale(series[i], 0);
        return out;
    }

    public double[][] inverseTransform(double[][] data) {
        requireFitted();
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = new double[data[i].length];
            for (int j = 0; j < data[i].length; j++) {
                out[i][j] = unscale(data[i][j], j);
            }
        }
        return out;
    }

    public double scale(double value, int column) {
        requireFitted();
        return (value - mean[column]) / (std[column] + EPSILON);
    }

    public double unscale(double value, int column) {
        requireFitted();
        return value * (std[column] + EPSILON) + mean[column];
    }

    private void requireFitted() {
        if (!fitted) {
            throw new IllegalStateException("Scaler не обучен");
        }
    }
}
