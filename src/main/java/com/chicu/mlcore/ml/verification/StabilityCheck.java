package com.chicu.mlcore.ml.verification;

import com.chicu.mlcore.ml.anomaly.AnomalyDetectorBase;
import com.chicu.mlcore.ml.anomaly.AnomalyRecord;
import com.chicu.mlcore.ml.error.ModelException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Устойчивость детектора: N независимых обучений на одних данных,
 * средний Jaccard между множествами найденных аномалий должен быть &gt; 0.8.
 */
@Slf4j
public final class StabilityCheck {

    public static final double PASS_SIMILARITY = 0.8;

    private StabilityCheck() {
    }

    /**
     * @param factory детектор по model_id ("stability_test_&lt;run&gt;")
     */
    public static <I> StabilityReport run(Function<String, ? extends AnomalyDetectorBase<I>> factory,
                                          I data,
                                          int runs) {
        List<Set<Integer>> anomalySets = new ArrayList<>();

        for (int run = 0; run < runs; run++) {
            try {
                AnomalyDetectorBase<I> detector = factory.apply("stability_test_" + run);
                detector.train(data);
                Set<Integer> flagged = new HashSet<>();
                for (AnomalyRecord r : detector.predict(data).predictions()) {
                    if (r.anomaly()) flagged.add(r.index());
                }
                anomalySets.add(flagged);
            } catch (ModelException e) {
                log.warn("⚠️ Stability run {} failed: {}", run, e.toString());
            }
        }

        if (anomalySets.size() < 2) {
            return new StabilityReport(false, 0.0, runs, anomalySets.size(),
                    "Insufficient successful runs for stability test");
        }

        double sum = 0;
        int pairs = 0;
        for (int i = 0; i < anomalySets.size(); i++) {
            for (int j = i + 1; j < anomalySets.size(); j++) {
                Set<Integer> union = new HashSet<>(anomalySets.get(i));
                union.addAll(anomalySets.get(j));
                Set<Integer> inter = new HashSet<>(anomalySets.get(i));
                inter.retainAll(anomalySets.get(j));
                sum += union.isEmpty() ? 1.0 : (double) inter.size() / union.size();
                pairs++;
            }
        }
        double avg = sum / pairs;
        return new StabilityReport(avg > PASS_SIMILARITY, avg, runs, anomalySets.size(), null);
    }
}
