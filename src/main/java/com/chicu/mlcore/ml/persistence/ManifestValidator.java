package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Проверка манифеста перед загрузкой. Fail-closed: первое же нарушение прерывает загрузку.
 * <ol>
 *     <li>обязательные поля → ValidationException</li>
 *     <li>schema_version из поддерживаемого набора → INCOMPATIBLE_VERSION</li>
 *     <li>описания артефактов: полнота, уникальные имена, имя файла без путей → ValidationException</li>
 *     <li>каждый артефакт: файл есть (MISSING_ARTIFACT), sha256 совпадает (CHECKSUM_MISMATCH)</li>
 * </ol>
 * Хешируется каждый файл целиком, стоимость O(суммарный размер артефактов).
 */
@Slf4j
public class ManifestValidator {

    private final Set<String> supportedSchemaVersions;

    public ManifestValidator(Set<String> supportedSchemaVersions) {
        if (supportedSchemaVersions == null || supportedSchemaVersions.isEmpty()) {
            throw new IllegalArgumentException("supportedSchemaVersions пустой");
        }
        this.supportedSchemaVersions = Set.copyOf(supportedSchemaVersions);
    }

    public Set<String> supportedSchemaVersions() {
        return supportedSchemaVersions;
    }

    public void validate(ModelManifest manifest, Path artifactDirectory) {
        if (manifest == null) {
            throw new ValidationException("manifest=null");
        }

        checkRequiredFields(manifest);
        checkSchemaVersion(manifest);
        checkArtifactEntries(manifest);

        for (ArtifactSpec spec : manifest.getArtifacts()) {
            checkArtifact(spec, artifactDirectory);
        }

        log.debug("✅ Manifest valid: {}|{}|{} artifacts={}",
                manifest.getModelType(), manifest.getModelId(), manifest.getVersion(), manifest.getArtifacts().size());
    }

    private void checkRequiredFields(ModelManifest m) {
        List<String> missing = new ArrayList<>();
        if (isBlank(m.getSchemaVersion())) missing.add("schema_version");
        if (isBlank(m.getModelId())) missing.add("model_id");
        if (isBlank(m.getModelType())) missing.add("model_type");
        if (isBlank(m.getVersion())) missing.add("version");
        if (m.getCreatedAt() == null) missing.add("created_at");
        if (m.getStatus() == null) missing.add("status");
        if (m.getArtifacts() == null) missing.add("artifacts");
        if (m.getHyperparameters() == null) missing.add("hyperparameters");
        if (m.getPerformanceMetrics() == null) missing.add("performance_metrics");
        if (m.getDependencies() == null) missing.add("dependencies");
        if (m.getTrainingSamples() < 0) missing.add("training_samples");

        if (!missing.isEmpty()) {
            throw new ValidationException(
                    "В манифесте нет обязательных полей: " + missing,
                    Map.of("missing_fields", List.copyOf(missing))
            );
        }
    }

    private void checkArtifactEntries(ModelManifest m) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < m.getArtifacts().size(); i++) {
            ArtifactSpec spec = m.getArtifacts().get(i);
            if (spec == null || isBlank(spec.name()) || isBlank(spec.filename())
                    || isBlank(spec.checksum()) || spec.artifactType() == null) {
                throw new ValidationException(
                        "Неполное описание артефакта artifacts[" + i + "]",
                        Map.of("index", i)
                );
            }
            if (!names.add(spec.name())) {
                throw new ValidationException(
                        "Имя артефакта повторяется: " + spec.name(),
                        Map.of("artifact", spec.name())
                );
            }
            Path fn = Path.of(spec.filename());
            if (fn.isAbsolute() || fn.getNameCount() != 1 || "..".equals(spec.filename())) {
                throw new ValidationException(
                        "Недопустимое имя файла артефакта: " + spec.filename(),
                        Map.of("artifact", spec.name(), "filename", spec.filename())
                );
            }
        }
    }

    private void checkSchemaVersion(ModelManifest m) {
        if (!supportedSchemaVersions.contains(m.getSchemaVersion())) {
            throw new PersistenceException(
                    "Неподдерживаемая версия схемы манифеста: " + m.getSchemaVersion(),
                    ErrorCode.INCOMPATIBLE_VERSION,
                    Map.of(
                            "schema_version", m.getSchemaVersion(),
                            "supported", List.copyOf(supportedSchemaVersions)
                    )
            );
        }
    }

    private void checkArtifact(ArtifactSpec spec, Path artifactDirectory) {
        Path file = artifactDirectory.resolve(spec.filename());

        if (!Files.isRegularFile(file)) {
            throw new PersistenceException(
                    "Артефакт отсутствует: " + spec.name() + " (" + file + ")",
                    ErrorCode.MISSING_ARTIFACT,
                    Map.of("artifact", spec.name(), "path", file.toString())
            );
        }

        String actual;
        try {
            actual = Checksums.sha256(file);
        } catch (IOException e) {
            throw new PersistenceException(
                    "Не удалось посчитать checksum для " + spec.name() + ": " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("artifact", spec.name(), "path", file.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }

        if (!actual.equals(spec.checksum().toLowerCase(Locale.ROOT))) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("artifact", spec.name());
            ctx.put("path", file.toString());
            ctx.put("expected", spec.checksum());
            ctx.put("actual", actual);
            throw new PersistenceException(
                    "Checksum не совпадает для артефакта " + spec.name(),
                    ErrorCode.CHECKSUM_MISMATCH,
                    ctx
            );
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
