package com.chicu.mlcore.ml.process;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.core.PredictionResult;
import com.chicu.mlcore.ml.features.EventRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery directly-follows графа и token-free conformance по нему.
 * <p>
 * Артефакты: graph (JSON), params (JSON).
 */
@Slf4j
public class DirectlyFollowsMiner extends ProcessMinerBase<DirectlyFollowsGraph> {

    public static final String MODEL_TYPE = "directly_follows";

    private long minEdgeCount;
    private double fitnessThreshold;

    private DirectlyFollowsGraph graph;

    public DirectlyFollowsMiner(ModelRuntime runtime, String modelId, String version,
                                long minEdgeCount, double fitnessThreshold) {
        super(runtime, modelId, MODEL_TYPE, version);
        if (minEdgeCount < 1) throw new IllegalArgumentException("minEdgeCount должен быть >= 1");
        if (!(fitnessThreshold > 0.0 && fitnessThreshold <= 1.0)) {
            throw new IllegalArgumentException("fitnessThreshold должен быть в (0, 1]");
        }
        this.minEdgeCount = minEdgeCount;
        this.fitnessThreshold = fitnessThreshold;

        hyperparameter("min_edge_count", minEdgeCount);
        hyperparameter("fitness_threshold", fitnessThreshold);

        registerArtifact("graph", "graph.json", ArtifactType.JSON, DirectlyFollowsGraph.class,
                () -> graph, v -> graph = v);
        registerArtifact("params", "params.json", ArtifactType.JSON, MinerParams.class,
                () -> new MinerParams(this.minEdgeCount, this.fitnessThreshold),
                p -> {
                    this.minEdgeCount = p.minEdgeCount();
                    this.fitnessThreshold = p.fitnessThreshold();
                });
    }

    public DirectlyFollowsMiner(ModelRuntime runtime, String modelId) {
        this(runtime, modelId, "1.0.0", 1, 1.0);
    }

    @Override
    protected int minTrainingSamples() {
        return 2;
    }

    @Override
    public DirectlyFollowsGraph discoverProcess(List<EventRecord> eventLog) {
        return DirectlyFollowsGraph.discover(EventLogs.traces(eventLog), minEdgeCount);
    }

    @Override
    public DirectlyFollowsGraph processModel() {
        return graph;
    }

    @Override
    protected Map<String, Double> fit(List<EventRecord> eventLog) {
        Map<String, List<String>> traces = EventLogs.traces(eventLog);
        DirectlyFollowsGraph g = DirectlyFollowsGraph.discover(traces, minEdgeCount);

        double fitnessSum = 0;
        int conforming = 0;
        for (Map.Entry<String, List<String>> t : traces.entrySet()) {
            CaseConformance c = check(g, t.getKey(), t.getValue());
            fitnessSum += c.fitness();
            if (c.conforming()) conforming++;
        }

        this.graph = g;

        log.info("🗺️ DFG discovered modelId={} cases={} activities={} edges={}",
                getModelId(), traces.size(), g.activities().size(), g.edgeCount());

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("n_activities", (double) g.activities().size());
        metrics.put("n_edges", (double) g.edgeCount());
        metrics.put("mean_fitness", fitnessSum / traces.size());
        metrics.put("conforming_rate", (double) conforming / traces.size());
        return metrics;
    }

    @Override
    protected PredictionResult<CaseConformance> infer(List<EventRecord> eventLog) {
        Map<String, List<String>> traces = EventLogs.traces(eventLog);

        List<CaseConformance> out = new ArrayList<>(traces.size());
        Map<String, Double> confidence = new LinkedHashMap<>();
        int deviant = 0;

        for (Map.Entry<String, List<String>> t : traces.entrySet()) {
            CaseConformance c = check(graph, t.getKey(), t.getValue());
            out.add(c);
            confidence.put(c.caseId(), c.fitness());
            if (!c.conforming()) deviant++;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model_type", MODEL_TYPE);
        meta.put("total_cases", out.size());
        meta.put("deviant_cases", deviant);
        return new PredictionResult<>(out, confidence, meta);
    }

    private CaseConformance check(DirectlyFollowsGraph g, String caseId, List<String> trace) {
        List<String> deviations = new ArrayList<>();
        if (!trace.isEmpty()) {
            if (!g.canStartWith(trace.get(0))) deviations.add("start:" + trace.get(0));
            for (int i = 1; i < trace.size(); i++) {
                if (!g.hasEdge(trace.get(i - 1), trace.get(i))) {
                    deviations.add(trace.get(i - 1) + "->" + trace.get(i));
                }
            }
            if (!g.canEndWith(trace.get(trace.size() - 1))) deviations.add("end:" + trace.get(trace.size() - 1));
        }

        int checks = Math.max(0, trace.size() - 1) + 2;
        double fitness = 1.0 - (double) deviations.size() / checks;
        return new CaseConformance(caseId, trace.size(), fitness, fitness >= fitnessThreshold, deviations);
    }
}
