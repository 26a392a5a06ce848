package com.chicu.mlcore.ml.registry;

import com.chicu.mlcore.ml.lifecycle.LifecycleContext;
import com.chicu.mlcore.ml.lifecycle.LifecycleHooks;
import com.chicu.mlcore.ml.persistence.ManifestCodec;
import com.chicu.mlcore.ml.persistence.ModelKeyFactory;
import com.chicu.mlcore.ml.persistence.ModelManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * after_save: регистрирует только что сохранённую версию по её manifest.json,
 * опционально сразу деплоит.
 */
@Slf4j
@RequiredArgsConstructor
public class RegistryPublishingHooks implements LifecycleHooks {

    private final ModelRegistry registry;
    private final ManifestCodec manifestCodec;

    /** null → только регистрация */
    private final String autoDeployTo;

    public RegistryPublishingHooks(ModelRegistry registry, ManifestCodec manifestCodec) {
        this(registry, manifestCodec, null);
    }

    @Override
    public void afterSave(LifecycleContext ctx) {
        Object path = ctx.payload().get("path");
        if (path == null) {
            log.warn("⚠️ after_save без path, регистрация пропущена: modelId={}", ctx.modelId());
            return;
        }

        Path dir = Path.of(path.toString());
        ModelManifest manifest = manifestCodec.read(ModelKeyFactory.manifestFile(dir));

        registry.register(manifest.getModelId(), manifest.getModelType(), manifest.getVersion(), manifest, dir);

        if (autoDeployTo != null) {
            registry.deploy(manifest.getModelType(), manifest.getModelId(), manifest.getVersion(), autoDeployTo);
        }
    }
}
