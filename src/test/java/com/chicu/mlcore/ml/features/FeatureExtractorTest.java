package com.chicu.mlcore.ml.features;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private static EventRecord event(String activity, String resource, double duration, double cost, String ts) {
        return new EventRecord("c1", activity, Instant.parse(ts), resource, duration, cost, Map.of());
    }

    @Test
    void encoder_shouldUseSortedIndexAndStableHash() {
        DeterministicEncoder enc = new DeterministicEncoder().fit(List.of("c", "a", "b", "a"));

        assertEquals(0, enc.encode("a"));
        assertEquals(1, enc.encode("b"));
        assertEquals(2, enc.encode("c"));

        int unseen = enc.encode("zzz");
        assertEquals(unseen, new DeterministicEncoder().fit(List.of("q")).encode("zzz"));
        assertEquals(DeterministicEncoder.hashBucket("zzz", DeterministicEncoder.DEFAULT_MAX_CATEGORIES), unseen);
        assertTrue(unseen >= 0 && unseen < DeterministicEncoder.DEFAULT_MAX_CATEGORIES);
    }

    @Test
    void encoder_notFitted_shouldThrow() {
        assertThrows(IllegalStateException.class, () -> new DeterministicEncoder().encode("a"));
    }

    @Test
    void scaler_shouldCenterAndRestore() {
        StandardScaler s = new StandardScaler().fit(new double[][]{{1.0, 10.0}, {3.0, 10.0}});

        double[][] t = s.transform(new double[][]{{1.0, 10.0}, {3.0, 10.0}});

        assertEquals(-1.0, t[0][0], 1e-6);
        assertEquals(1.0, t[1][0], 1e-6);
        assertEquals(0.0, t[0][1], 1e-12, "константная колонка → 0");
        assertEquals(3.0, s.inverseTransform(t)[1][0], 1e-6);
    }

    @Test
    void scaler_shouldUsePopulationStd() {
        StandardScaler s = new StandardScaler().fit(new double[][]{{2.0}, {4.0}, {4.0}, {4.0}, {5.0}, {5.0}, {7.0}, {9.0}});

        assertEquals(5.0, s.getMean()[0], 1e-12);
        assertEquals(2.0, s.getStd()[0], 1e-12);
    }

    @Test
    void transform_shouldExtractTemporalColumnsInUtc() {
        FeatureConfig cfg = new FeatureConfig(List.of("duration"), List.of("activity"), List.of("timestamp"), false);
        FeatureExtractor fx = new FeatureExtractor(cfg);

        // 2024-01-01 — понедельник
        double[][] x = fx.fitTransform(List.of(
                event("b", "r1", 5.0, 1.0, "2024-01-01T10:00:00Z"),
                event("a", "r1", 7.0, 1.0, "2024-01-03T23:30:00Z")
        ));

        assertEquals(List.of("duration", "activity", "timestamp_hour", "timestamp_weekday"), fx.getFeatureNames());
        assertArrayEquals(new double[]{5.0, 1.0, 10.0, 0.0}, x[0], 0.0);
        assertArrayEquals(new double[]{7.0, 0.0, 23.0, 2.0}, x[1], 0.0);
    }

    @Test
    void transform_missingValues_shouldBecomeZero() {
        FeatureConfig cfg = new FeatureConfig(List.of("duration", "priority"), List.of(), List.of("timestamp"), false);
        FeatureExtractor fx = new FeatureExtractor(cfg).fit(List.of(EventRecord.of("c1", "a", null)));

        double[][] x = fx.transform(List.of(
                new EventRecord("c1", "a", null, null, null, null, Map.of("priority", "3.5"))));

        assertArrayEquals(new double[]{0.0, 3.5, 0.0, 0.0}, x[0], 0.0);
    }

    @Test
    void transform_beforeFit_shouldThrow() {
        FeatureExtractor fx = new FeatureExtractor(FeatureConfig.defaults());

        assertThrows(IllegalStateException.class, () -> fx.transform(List.of(EventRecord.of("c", "a", Instant.EPOCH))));
    }

    @Test
    void json_shouldRestoreSameEncoding() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        List<EventRecord> events = List.of(
                event("approve", "alice", 3.0, 10.0, "2024-02-05T08:00:00Z"),
                event("submit", "bob", 1.0, 5.0, "2024-02-06T09:00:00Z"),
                event("reject", "alice", 9.0, 50.0, "2024-02-07T17:00:00Z")
        );
        FeatureExtractor fx = new FeatureExtractor(FeatureConfig.defaults()).fit(events);

        FeatureExtractor restored = mapper.readValue(mapper.writeValueAsString(fx), FeatureExtractor.class);

        assertTrue(restored.isFitted());
        assertEquals(fx.getConfig(), restored.getConfig());
        double[][] a = fx.transform(events);
        double[][] b = restored.transform(events);
        for (int i = 0; i < a.length; i++) {
            assertArrayEquals(a[i], b[i], 1e-12);
        }
        assertEquals(fx.getSchema().schemaHash(), restored.getSchema().schemaHash());
    }

    @Test
    void schema_hashShouldDependOnOrder() {
        FeatureSchema ab = FeatureSchema.of(List.of("a", "b"));
        FeatureSchema ba = FeatureSchema.of(List.of("b", "a"));

        assertNotEquals(ab.schemaHash(), ba.schemaHash());
        assertEquals(ab.schemaHash(), FeatureSchema.of(List.of("a", "b")).schemaHash());
        assertEquals(List.of("a", "b"), ab.names());
    }
}
