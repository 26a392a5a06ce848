package com.chicu.mlcore.ml.process;

import com.chicu.mlcore.ml.error.ValidationException;
import com.chicu.mlcore.ml.features.EventRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Журнал событий → трассы по case_id.
 */
public final class EventLogs {

    private static final Comparator<EventRecord> BY_TIME =
            Comparator.comparing(EventRecord::timestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    private EventLogs() {
    }

    /**
     * case_id → активности по времени. Порядок case'ов — по первому появлению в журнале,
     * события без timestamp идут в конец трассы в исходном порядке.
     */
    public static Map<String, List<String>> traces(List<EventRecord> events) {
        if (events == null) throw new ValidationException("events=null");

        Map<String, List<EventRecord>> byCase = new LinkedHashMap<>();
        for (int i = 0; i < events.size(); i++) {
            EventRecord e = events.get(i);
            if (e == null || e.caseId() == null || e.caseId().isBlank()) {
                throw new ValidationException("Событие без case_id: index=" + i, Map.of("index", i));
            }
            if (e.activity() == null || e.activity().isBlank()) {
                throw new ValidationException("Событие без activity: index=" + i,
                        Map.of("index", i, "case_id", e.caseId()));
            }
            byCase.computeIfAbsent(e.caseId(), k -> new ArrayList<>()).add(e);
        }

        Map<String, List<String>> traces = new LinkedHashMap<>();
        byCase.forEach((caseId, list) -> {
            List<EventRecord> sorted = new ArrayList<>(list);
            sorted.sort(BY_TIME);
            traces.put(caseId, sorted.stream().map(EventRecord::activity).toList());
        });
        return traces;
    }
}
