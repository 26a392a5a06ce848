package com.chicu.mlcore.ml.registry;

import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.ValidationException;
import com.chicu.mlcore.ml.persistence.ModelManifest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Реестр в одном JSON-файле. Документ держится в памяти, после каждого
 * register/deploy переписывается целиком.
 * <p>
 * Изменение применяется к копии документа; в память она попадает только после
 * успешной записи файла.
 * <p>
 * Методы synchronized: защищают только этот экземпляр. Несколько процессов
 * на один файл должны договариваться сами.
 */
@Slf4j
public class FileModelRegistry implements ModelRegistry {

    private final Path registryFile;
    private final ObjectMapper mapper;

    private RegistryDocument document;

    public FileModelRegistry(Path registryFile, ObjectMapper base) {
        if (registryFile == null) throw new IllegalArgumentException("registryFile=null");
        this.registryFile = registryFile;
        this.mapper = base.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.document = read();
    }

    public Path getRegistryFile() {
        return registryFile;
    }

    @Override
    public synchronized void register(String modelId,
                                      String modelType,
                                      String version,
                                      ModelManifest manifest,
                                      Path storagePath) {
        requireText(modelId, "model_id");
        requireText(modelType, "model_type");
        requireText(version, "version");
        if (manifest == null) throw new ValidationException("manifest=null", Map.of("model_id", modelId));
        if (storagePath == null) throw new ValidationException("storagePath=null", Map.of("model_id", modelId));

        if (!modelId.equals(manifest.getModelId())
                || !modelType.equals(manifest.getModelType())
                || !version.equals(manifest.getVersion())) {
            throw new ValidationException(
                    "Манифест не соответствует регистрируемой версии",
                    Map.of(
                            "expected", modelType + "|" + modelId + "|" + version,
                            "manifest", manifest.getModelType() + "|" + manifest.getModelId() + "|" + manifest.getVersion()
                    )
            );
        }

        ModelVersionInfo info = new ModelVersionInfo(
                version,
                storagePath.toString(),
                Instant.now(),
                manifest.getTrainedAt(),
                manifest.getPerformanceMetrics(),
                manifest.getHyperparameters(),
                manifest.getTrainingSamples(),
                manifest.getStatus() != null ? manifest.getStatus().wireName() : null,
                manifest.getSchemaVersion(),
                manifest.getInputSchemaVersion()
        );

        RegistryDocument next = document.copy();
        next.getModels()
                .computeIfAbsent(modelType, k -> new TreeMap<>())
                .merge(modelId, ModelEntry.empty().append(info), (old, fresh) -> old.append(info));

        commit(next);
        log.info("📝 Registered model type={} id={} version={} path={}", modelType, modelId, version, storagePath);
    }

    @Override
    public synchronized Optional<ModelVersionInfo> getLatestVersion(String modelType, String modelId) {
        return entry(modelType, modelId).flatMap(ModelEntry::latest);
    }

    @Override
    public synchronized Optional<DeploymentInfo> getDeployedModel(String modelType, String deploymentName) {
        Map<String, DeploymentInfo> byType = document.getDeployments().get(deploymentName);
        return byType == null ? Optional.empty() : Optional.ofNullable(byType.get(modelType));
    }

    @Override
    public synchronized boolean deploy(String modelType, String modelId, String version, String deploymentName) {
        requireText(deploymentName, "deployment_name");

        Optional<ModelVersionInfo> target = entry(modelType, modelId).flatMap(e -> e.find(version));
        if (target.isEmpty()) {
            log.warn("⚠️ Deploy skipped: нет версии type={} id={} version={}", modelType, modelId, version);
            return false;
        }

        DeploymentInfo info = new DeploymentInfo(modelId, version, Instant.now(), target.get().modelPath());
        RegistryDocument next = document.copy();
        next.getDeployments()
                .computeIfAbsent(deploymentName, k -> new TreeMap<>())
                .put(modelType, info);

        commit(next);
        log.info("🚀 Deployed type={} id={} version={} → {}", modelType, modelId, version, deploymentName);
        return true;
    }

    @Override
    public synchronized Optional<ModelEntry> getModelInfo(String modelType, String modelId) {
        return entry(modelType, modelId);
    }

    @Override
    public synchronized Map<String, Map<String, ModelEntry>> listModels(String modelType) {
        Map<String, Map<String, ModelEntry>> out = new LinkedHashMap<>();
        if (modelType != null) {
            out.put(modelType, Map.copyOf(document.getModels().getOrDefault(modelType, Map.of())));
            return out;
        }
        document.getModels().forEach((type, byId) -> out.put(type, Map.copyOf(byId)));
        return out;
    }

    // =====================================================================

    private Optional<ModelEntry> entry(String modelType, String modelId) {
        Map<String, ModelEntry> byId = document.getModels().get(modelType);
        return byId == null ? Optional.empty() : Optional.ofNullable(byId.get(modelId));
    }

    private RegistryDocument read() {
        if (!Files.isRegularFile(registryFile)) {
            return new RegistryDocument();
        }
        try {
            RegistryDocument doc = mapper.readValue(registryFile.toFile(), RegistryDocument.class);
            if (doc == null) return new RegistryDocument();
            // Jackson отдаёт LinkedHashMap, а порядок ключей в файле нужен стабильный
            RegistryDocument normalized = doc.copy();
            log.info("📚 Registry loaded: file={} types={}", registryFile, normalized.getModels().size());
            return normalized;
        } catch (IOException e) {
            throw new PersistenceException(
                    "Не удалось прочитать реестр: " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("path", registryFile.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }
    }

    private void commit(RegistryDocument next) {
        try {
            Path parent = registryFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(registryFile.toFile(), next);
        } catch (IOException e) {
            throw new PersistenceException(
                    "Не удалось записать реестр: " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("path", registryFile.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }
        this.document = next;
    }

    private static void requireText(String v, String field) {
        if (v == null || v.isBlank()) {
            throw new ValidationException(field + " пустой", Map.of("field", field));
        }
    }
}
