package com.chicu.mlcore.ml.registry;

import com.chicu.mlcore.ml.persistence.ModelManifest;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр версий и деплойментов. Читает манифесты, которые пишет ядро,
 * сами артефакты не открывает и не проверяет.
 */
public interface ModelRegistry {

    String DEFAULT_DEPLOYMENT = "production";

    /**
     * Добавить версию. Повторная регистрация того же тега — новая запись, старые не меняются.
     */
    void register(String modelId, String modelType, String version, ModelManifest manifest, Path storagePath);

    /** Последняя зарегистрированная версия. */
    Optional<ModelVersionInfo> getLatestVersion(String modelType, String modelId);

    Optional<DeploymentInfo> getDeployedModel(String modelType, String deploymentName);

    default Optional<DeploymentInfo> getDeployedModel(String modelType) {
        return getDeployedModel(modelType, DEFAULT_DEPLOYMENT);
    }

    /**
     * @return false, если такой модели или версии нет
     */
    boolean deploy(String modelType, String modelId, String version, String deploymentName);

    default boolean deploy(String modelType, String modelId, String version) {
        return deploy(modelType, modelId, version, DEFAULT_DEPLOYMENT);
    }

    Optional<ModelEntry> getModelInfo(String modelType, String modelId);

    /**
     * @param modelType null → все типы
     * @return type → (id → entry)
     */
    Map<String, Map<String, ModelEntry>> listModels(String modelType);
}
