package com.chicu.mlcore.ml.process;

import com.chicu.mlcore.ml.core.ModelBase;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.error.ValidationException;
import com.chicu.mlcore.ml.features.EventRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Модели process mining: обучение = discovery модели процесса по журналу,
 * предсказание = conformance каждого case'а к обученной модели.
 * evaluate принимает case_id заведомо отклоняющихся case'ов.
 *
 * @param <M> представление модели процесса
 */
public abstract class ProcessMinerBase<M> extends ModelBase<List<EventRecord>, CaseConformance, Set<String>> {

    protected ProcessMinerBase(ModelRuntime runtime, String modelId, String modelType, String version) {
        super(runtime, modelId, modelType, version);
    }

    /** Discovery без изменения состояния модели. */
    public abstract M discoverProcess(List<EventRecord> eventLog);

    /** Обученная модель процесса или null. */
    public abstract M processModel();

    @Override
    protected int sampleCount(List<EventRecord> data) {
        return EventLogs.traces(data).size();
    }

    @Override
    public Map<String, Double> evaluate(List<EventRecord> eventLog, Set<String> deviantCases) {
        if (deviantCases == null) {
            throw new ValidationException("deviantCases=null", Map.of("model_id", getModelId()));
        }
        List<CaseConformance> predicted = predict(eventLog).predictions();

        int tp = 0, fp = 0, tn = 0, fn = 0;
        for (CaseConformance c : predicted) {
            boolean flagged = !c.conforming();
            boolean actual = deviantCases.contains(c.caseId());
            if (flagged && actual) tp++;
            else if (flagged) fp++;
            else if (actual) fn++;
            else tn++;
        }

        int total = predicted.size();
        double precision = (tp + fp) > 0 ? (double) tp / (tp + fp) : 0.0;
        double recall = (tp + fn) > 0 ? (double) tp / (tp + fn) : 0.0;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("accuracy", total > 0 ? (double) (tp + tn) / total : 0.0);
        metrics.put("precision", precision);
        metrics.put("recall", recall);
        metrics.put("f1_score", (precision + recall) > 0 ? 2 * precision * recall / (precision + recall) : 0.0);

        recordMetrics(metrics);
        return metrics;
    }
}
