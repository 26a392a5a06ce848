package com.chicu.mlcore.ml.registry;

import com.chicu.mlcore.ml.core.ModelBase;
import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

/**
 * Поднимает задеплоенную версию: реестр → путь → новый экземпляр обёртки → load().
 */
@Slf4j
@RequiredArgsConstructor
public class DeployedModelLoader {

    private final ModelRegistry registry;

    public <M extends ModelBase<?, ?, ?>> M load(String modelType, Function<DeploymentInfo, M> factory) {
        return load(modelType, ModelRegistry.DEFAULT_DEPLOYMENT, factory);
    }

    /**
     * @param factory создаёт пустую обёртку нужного типа под деплоймент
     */
    public <M extends ModelBase<?, ?, ?>> M load(String modelType,
                                                String deploymentName,
                                                Function<DeploymentInfo, M> factory) {
        DeploymentInfo deployment = registry.getDeployedModel(modelType, deploymentName)
                .orElseThrow(() -> new PersistenceException(
                        "Нет деплоймента " + deploymentName + " для типа " + modelType,
                        ErrorCode.MISSING_ARTIFACT,
                        Map.of("model_type", modelType, "deployment", deploymentName)
                ));

        M model = factory.apply(deployment);
        model.load(Path.of(deployment.modelPath()));

        if (!deployment.modelId().equals(model.getModelId()) || !deployment.version().equals(model.getVersion())) {
            throw new ValidationException(
                    "По пути деплоймента лежит другая модель",
                    Map.of(
                            "expected", deployment.modelId() + "|" + deployment.version(),
                            "actual", model.getModelId() + "|" + model.getVersion()
                    )
            );
        }

        log.info("📦 Deployed model loaded: type={} id={} version={} deployment={}",
                modelType, deployment.modelId(), deployment.version(), deploymentName);
        return model;
    }
}
