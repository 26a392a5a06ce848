package com.chicu.mlcore.ml.dataset;

import com.chicu.mlcore.ml.error.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * TrainingDatasetBuilder
 * ======================
 * Собирает матрицу признаков (и, если есть, метки 0/1) из сырых строк
 * и проверяет её форму до того, как она попадёт во внешнюю библиотеку.
 */
@Slf4j
public class TrainingDatasetBuilder {

    /**
     * Сырые строки до сборки. y может быть null (датасет без разметки).
     */
    public record Rows(
            String datasetId,
            List<double[]> xRows,
            List<Integer> y
    ) {
        public static Rows empty() {
            return new Rows(UUID.randomUUID().toString(), new ArrayList<>(), new ArrayList<>());
        }

        public Rows add(double[] x, Integer label) {
            xRows.add(x);
            if (y != null) y.add(label);
            return this;
        }
    }

    /**
     * X: [n_samples][n_features]; y: [n_samples] или null.
     */
    public record Dataset(
            String datasetId,
            double[][] x,
            int[] y,
            int samples,
            int features
    ) {
        public boolean labeled() {
            return y != null;
        }
    }

    public Dataset build(Rows rows) {
        if (rows == null) throw new ValidationException("rows=null");

        List<double[]> xRows = rows.xRows();
        List<Integer> yList = rows.y();

        if (xRows == null) {
            throw new ValidationException("rows.xRows=null");
        }
        if (xRows.isEmpty()) {
            throw new ValidationException("dataset пустой (xRows=0)");
        }
        if (yList != null && xRows.size() != yList.size()) {
            throw new ValidationException(
                    "размеры не совпадают: xRows=" + xRows.size() + " y=" + yList.size(),
                    Map.of("x_rows", xRows.size(), "y", yList.size())
            );
        }

        double[][] x = checkMatrix(xRows.toArray(new double[0][]));
        int n = x.length;
        int f = x[0].length;

        int[] y = null;
        if (yList != null) {
            y = new int[n];
            for (int i = 0; i < n; i++) {
                Integer lbl = yList.get(i);
                if (lbl == null) throw new ValidationException("y[" + i + "]=null");
                if (lbl != 0 && lbl != 1) {
                    throw new ValidationException(
                            "y[" + i + "] должен быть 0/1, а пришло: " + lbl,
                            Map.of("index", i, "label", lbl)
                    );
                }
                y[i] = lbl;
            }
        }

        String id = (rows.datasetId() == null || rows.datasetId().isBlank())
                ? UUID.randomUUID().toString()
                : rows.datasetId().trim();

        log.info("📦 Dataset built: id={} samples={} features={} labeled={}", id, n, f, y != null);

        return new Dataset(id, x, y, n, f);
    }

    /**
     * Прямоугольная матрица конечных чисел, хотя бы одна колонка.
     * Возвращает копию.
     */
    public static double[][] checkMatrix(double[][] rows) {
        if (rows == null) throw new ValidationException("matrix=null");

        int f = -1;
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] r = rows[i];
            if (r == null) throw new ValidationException("row[" + i + "]=null");
            if (f < 0) f = r.length;
            if (r.length != f) {
                throw new ValidationException(
                        "разная длина фич: row=" + i + " len=" + r.length + " expected=" + f,
                        Map.of("row", i, "length", r.length, "expected", f)
                );
            }
            for (int j = 0; j < r.length; j++) {
                if (!Double.isFinite(r[j])) {
                    throw new ValidationException(
                            "нечисловое значение в row=" + i + " col=" + j,
                            Map.of("row", i, "col", j)
                    );
                }
            }
            copy[i] = r.clone();
        }
        if (f == 0) {
            throw new ValidationException("матрица без колонок");
        }
        return copy;
    }
}
