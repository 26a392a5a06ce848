package com.chicu.mlcore.ml.process;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directly-follows граф: какие активности встречаются, кто за кем идёт (с частотами),
 * с чего case'ы начинаются и чем заканчиваются.
 */
public record DirectlyFollowsGraph(
        @JsonProperty("activities") List<String> activities,
        @JsonProperty("edges") Map<String, Map<String, Long>> edges,
        @JsonProperty("start_activities") Map<String, Long> startActivities,
        @JsonProperty("end_activities") Map<String, Long> endActivities,
        @JsonProperty("case_count") int caseCount
) {

    public DirectlyFollowsGraph {
        activities = activities == null ? List.of() : List.copyOf(activities);
        edges = edges == null ? Map.of() : edges;
        startActivities = startActivities == null ? Map.of() : startActivities;
        endActivities = endActivities == null ? Map.of() : endActivities;
    }

    /**
     * @param minEdgeCount рёбра реже этого порога отбрасываются как шум
     */
    public static DirectlyFollowsGraph discover(Map<String, List<String>> traces, long minEdgeCount) {
        TreeSet<String> activities = new TreeSet<>();
        Map<String, Map<String, Long>> edges = new TreeMap<>();
        Map<String, Long> starts = new TreeMap<>();
        Map<String, Long> ends = new TreeMap<>();

        for (List<String> trace : traces.values()) {
            if (trace.isEmpty()) continue;
            activities.addAll(trace);
            starts.merge(trace.get(0), 1L, Long::sum);
            ends.merge(trace.get(trace.size() - 1), 1L, Long::sum);
            for (int i = 1; i < trace.size(); i++) {
                edges.computeIfAbsent(trace.get(i - 1), k -> new TreeMap<>())
                        .merge(trace.get(i), 1L, Long::sum);
            }
        }

        if (minEdgeCount > 1) {
            edges.values().forEach(targets -> targets.values().removeIf(c -> c < minEdgeCount));
            edges.values().removeIf(Map::isEmpty);
        }

        return new DirectlyFollowsGraph(List.copyOf(activities), edges, starts, ends, traces.size());
    }

    public boolean hasEdge(String from, String to) {
        Map<String, Long> targets = edges.get(from);
        return targets != null && targets.containsKey(to);
    }

    public boolean canStartWith(String activity) {
        return startActivities.containsKey(activity);
    }

    public boolean canEndWith(String activity) {
        return endActivities.containsKey(activity);
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Map::size).sum();
    }
}
