package com.chicu.mlcore.ml.verification;

import com.chicu.mlcore.ml.core.ModelBase;
import com.chicu.mlcore.ml.error.ModelException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * predict → save → load в новый экземпляр → predict → сравнение.
 * <p>
 * Предсказания сравниваются через их JSON-форму: числа с допуском
 * |a - b| &lt;= atol + rtol·|b|, всё остальное — на точное равенство.
 */
@Slf4j
@RequiredArgsConstructor
public class PersistenceVerifier {

    public static final double DEFAULT_RTOL = 1e-5;
    public static final double ABSOLUTE_TOLERANCE = 1e-8;

    private static final int MAX_REPORTED_MISMATCHES = 20;

    private final ObjectMapper objectMapper;
    private final double rtol;

    public PersistenceVerifier(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_RTOL);
    }

    public <I, P> VerificationReport verify(ModelBase<I, P, ?> model,
                                            Supplier<? extends ModelBase<I, P, ?>> freshInstance,
                                            I testData,
                                            Path directory) {
        List<P> original;
        List<P> restored;
        Path saved = null;
        try {
            original = model.predict(testData).predictions();
            saved = model.save(directory);

            ModelBase<I, P, ?> fresh = freshInstance.get();
            fresh.load(saved);
            restored = fresh.predict(testData).predictions();
        } catch (ModelException e) {
            log.warn("❌ Persistence check failed modelId={} err={}", model.getModelId(), e.toString());
            return new VerificationReport(false, 0, 0, List.of(),
                    saved != null ? saved.toString() : null, e.getCode() + ": " + e.getMessage());
        }

        List<String> mismatches = new ArrayList<>();
        if (original.size() != restored.size()) {
            mismatches.add("size: " + original.size() + " != " + restored.size());
        } else {
            for (int i = 0; i < original.size() && mismatches.size() < MAX_REPORTED_MISMATCHES; i++) {
                compare("[" + i + "]",
                        objectMapper.valueToTree(original.get(i)),
                        objectMapper.valueToTree(restored.get(i)),
                        mismatches);
            }
        }

        boolean passed = mismatches.isEmpty();
        log.info("{} Persistence check modelId={} predictions={} mismatches={}",
                passed ? "✅" : "❌", model.getModelId(), original.size(), mismatches.size());

        return new VerificationReport(passed, original.size(), restored.size(), mismatches, saved.toString(), null);
    }

    private void compare(String path, JsonNode a, JsonNode b, List<String> out) {
        if (a.isNumber() && b.isNumber()) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            if (Math.abs(x - y) > ABSOLUTE_TOLERANCE + rtol * Math.abs(y)) {
                out.add(path + ": " + x + " != " + y);
            }
            return;
        }
        if (a.isObject() && b.isObject()) {
            if (a.size() != b.size()) {
                out.add(path + ": поля " + a.size() + " != " + b.size());
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> it = a.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> f = it.next();
                JsonNode other = b.get(f.getKey());
                if (other == null) {
                    out.add(path + "." + f.getKey() + ": нет в загруженной модели");
                } else {
                    compare(path + "." + f.getKey(), f.getValue(), other, out);
                }
            }
            return;
        }
        if (a.isArray() && b.isArray()) {
            if (a.size() != b.size()) {
                out.add(path + ": длина " + a.size() + " != " + b.size());
                return;
            }
            for (int i = 0; i < a.size(); i++) {
                compare(path + "[" + i + "]", a.get(i), b.get(i), out);
            }
            return;
        }
        if (!a.equals(b)) {
            out.add(path + ": " + a + " != " + b);
        }
    }
}
