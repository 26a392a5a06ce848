package com.chicu.mlcore.ml.verification;

import com.chicu.mlcore.ml.anomaly.DbscanAnomalyDetector;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticAnomalyEvaluatorTest {

    @TempDir
    Path root;

    private DbscanAnomalyDetector detector;

    private static double[][] blob(int n, long seed) {
        Random rnd = new Random(seed);
        double[][] x = new double[n][2];
        for (int i = 0; i < n; i++) {
            x[i][0] = rnd.nextGaussian() * 0.3;
            x[i][1] = rnd.nextGaussian() * 0.3;
        }
        return x;
    }

    @BeforeEach
    void setUp() {
        detector = new DbscanAnomalyDetector(ModelRuntime.standalone(root), "det", "1.0.0", 0.5, 4, 0.05);
        detector.train(blob(100, 42));
    }

    @Test
    void evaluate_shouldLabelInjectedShare() {
        Map<String, Double> m = SyntheticAnomalyEvaluator.evaluate(detector, blob(100, 42), 0.1, 11L);

        assertEquals(10.0, m.get("true_positives") + m.get("false_negatives"), 0.0);
        assertEquals(100.0, m.get("true_positives") + m.get("false_negatives")
                + m.get("false_positives") + m.get("true_negatives"), 0.0);
        assertTrue(m.get("recall") > 0.0);
        assertTrue(m.containsKey("f1_score"));
    }

    @Test
    void evaluate_sameSeed_shouldGiveSameMetrics() {
        double[][] normal = blob(100, 42);

        Map<String, Double> first = SyntheticAnomalyEvaluator.evaluate(detector, normal, 11L);
        Map<String, Double> second = SyntheticAnomalyEvaluator.evaluate(detector, normal, 11L);

        assertEquals(first, second);
    }

    @Test
    void evaluate_shouldNotMutateInput() {
        double[][] normal = blob(50, 3);
        double[][] copy = blob(50, 3);

        SyntheticAnomalyEvaluator.evaluate(detector, normal, 0.2, 5L);

        for (int i = 0; i < normal.length; i++) {
            assertArrayEquals(copy[i], normal[i], 0.0);
        }
    }

    @Test
    void evaluate_rateOutOfRange_shouldThrow() {
        assertThrows(ValidationException.class,
                () -> SyntheticAnomalyEvaluator.evaluate(detector, blob(20, 1), 1.0, 1L));
        assertThrows(ValidationException.class,
                () -> SyntheticAnomalyEvaluator.evaluate(detector, blob(20, 1), 0.0, 1L));
    }
}
