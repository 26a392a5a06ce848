package com.chicu.mlcore.ml.forecast;

import java.time.Instant;
import java.util.List;

/**
 * Значения ряда с метками времени, в хронологическом порядке.
 */
public record TimestampedSeries(List<Instant> timestamps, double[] values) {

    public TimestampedSeries {
        timestamps = List.copyOf(timestamps);
        values = values.clone();
    }

    public int size() {
        return values.length;
    }
}
