package com.chicu.mlcore.ml.features;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Журнал событий → матрица признаков.
 * <p>
 * Порядок колонок: числовые, категориальные (коды), временные (час, день недели).
 * Обученный экстрактор сохраняется как JSON-артефакт рядом с моделью,
 * чтобы predict после load() видел ровно те же коды и ту же нормализацию.
 */
@Getter
@NoArgsConstructor
public class FeatureExtractor {

    @JsonProperty("config")
    private FeatureConfig config = FeatureConfig.defaults();

    @JsonProperty("categorical_encoders")
    private Map<String, DeterministicEncoder> categoricalEncoders = new LinkedHashMap<>();

    @JsonProperty("scaler")
    private StandardScaler scaler;

    @JsonProperty("is_fitted")
    private boolean fitted;

    public FeatureExtractor(FeatureConfig config) {
        this.config = config != null ? config : FeatureConfig.defaults();
    }

    public FeatureExtractor fit(List<EventRecord> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("FeatureExtractor: пустой журнал событий");
        }

        Map<String, DeterministicEncoder> encoders = new LinkedHashMap<>();
        for (String feature : config.categoricalFeatures()) {
            List<String> categories = new ArrayList<>(events.size());
            for (EventRecord e : events) {
                categories.add(asCategory(e.field(feature)));
            }
            encoders.put(feature, new DeterministicEncoder().fit(categories));
        }
        this.categoricalEncoders = encoders;

        this.scaler = config.useNormalization()
                ? new StandardScaler().fit(extractRaw(events))
                : null;
        this.fitted = true;
        return this;
    }

    public double[][] transform(List<EventRecord> events) {
        if (!fitted) {
            throw new IllegalStateException("FeatureExtractor не обучен");
        }
        double[][] raw = extractRaw(events);
        return scaler != null ? scaler.transform(raw) : raw;
    }

    public double[][] fitTransform(List<EventRecord> events) {
        return fit(events).transform(events);
    }

    @JsonIgnore
    public List<String> getFeatureNames() {
        List<String> names = new ArrayList<>(config.numericalFeatures());
        names.addAll(config.categoricalFeatures());
        for (String t : config.temporalFeatures()) {
            names.add(t + "_hour");
            names.add(t + "_weekday");
        }
        return names;
    }

    @JsonIgnore
    public FeatureSchema getSchema() {
        return FeatureSchema.of(getFeatureNames());
    }

    private double[][] extractRaw(List<EventRecord> events) {
        int width = config.numericalFeatures().size()
                + config.categoricalFeatures().size()
                + 2 * config.temporalFeatures().size();
        double[][] matrix = new double[events.size()][width];

        for (int i = 0; i < events.size(); i++) {
            EventRecord e = events.get(i);
            double[] row = matrix[i];
            int c = 0;

            for (String f : config.numericalFeatures()) {
                row[c++] = asNumber(e.field(f));
            }

            for (String f : config.categoricalFeatures()) {
                String category = asCategory(e.field(f));
                DeterministicEncoder enc = categoricalEncoders.get(f);
                row[c++] = enc != null
                        ? enc.encode(category)
                        : DeterministicEncoder.hashBucket(category, DeterministicEncoder.DEFAULT_MAX_CATEGORIES);
            }

            for (String f : config.temporalFeatures()) {
                Object ts = e.field(f);
                if (ts instanceof Instant instant) {
                    ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
                    row[c++] = utc.getHour();
                    row[c++] = utc.getDayOfWeek().getValue() - 1;
                } else {
                    row[c++] = 0.0;
                    row[c++] = 0.0;
                }
            }
        }
        return matrix;
    }

    private static double asNumber(Object v) {
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : 0.0;
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private static String asCategory(Object v) {
        return v == null ? "" : String.valueOf(v);
    }
}
