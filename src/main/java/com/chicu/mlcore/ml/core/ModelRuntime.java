package com.chicu.mlcore.ml.core;

import com.chicu.mlcore.ml.lifecycle.LifecycleHooks;
import com.chicu.mlcore.ml.persistence.ArtifactStore;
import com.chicu.mlcore.ml.persistence.ManifestCodec;
import com.chicu.mlcore.ml.persistence.ManifestValidator;
import com.chicu.mlcore.ml.persistence.ModelManifest;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Общие коллабораторы для всех обёрток моделей: хранилище артефактов,
 * кодек и валидатор манифеста, корень хранилища и хуки по умолчанию.
 * <p>
 * В Spring собирается в MlCoreConfig; вне Spring — через {@link #standalone(Path, LifecycleHooks...)}.
 */
public record ModelRuntime(
        ArtifactStore artifactStore,
        ManifestCodec manifestCodec,
        ManifestValidator manifestValidator,
        Path modelsRoot,
        String schemaVersion,
        List<LifecycleHooks> hooks
) {

    public ModelRuntime {
        Objects.requireNonNull(artifactStore, "artifactStore");
        Objects.requireNonNull(manifestCodec, "manifestCodec");
        Objects.requireNonNull(manifestValidator, "manifestValidator");
        Objects.requireNonNull(modelsRoot, "modelsRoot");
        Objects.requireNonNull(schemaVersion, "schemaVersion");
        if (!manifestValidator.supportedSchemaVersions().contains(schemaVersion)) {
            throw new IllegalArgumentException("schemaVersion " + schemaVersion + " не входит в поддерживаемые "
                    + manifestValidator.supportedSchemaVersions());
        }
        hooks = hooks == null ? List.of() : List.copyOf(hooks);
    }

    public static ModelRuntime standalone(Path modelsRoot, LifecycleHooks... hooks) {
        ObjectMapper om = new ObjectMapper().findAndRegisterModules();
        return new ModelRuntime(
                new ArtifactStore(om),
                new ManifestCodec(om),
                new ManifestValidator(ModelManifest.SUPPORTED_SCHEMA_VERSIONS),
                modelsRoot,
                ModelManifest.CURRENT_SCHEMA_VERSION,
                Arrays.asList(hooks)
        );
    }

    public ModelRuntime withHooks(LifecycleHooks... extra) {
        List<LifecycleHooks> all = new ArrayList<>(hooks);
        all.addAll(Arrays.asList(extra));
        return new ModelRuntime(artifactStore, manifestCodec, manifestValidator, modelsRoot, schemaVersion, all);
    }
}
