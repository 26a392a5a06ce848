package com.chicu.mlcore.config;

import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.lifecycle.LifecycleHooks;
import com.chicu.mlcore.ml.persistence.ArtifactStore;
import com.chicu.mlcore.ml.persistence.ManifestCodec;
import com.chicu.mlcore.ml.persistence.ManifestValidator;
import com.chicu.mlcore.ml.registry.DeployedModelLoader;
import com.chicu.mlcore.ml.registry.FileModelRegistry;
import com.chicu.mlcore.ml.registry.ModelRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(MlStorageProperties.class)
public class MlCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public ArtifactStore artifactStore(ObjectMapper om) {
        return new ArtifactStore(om);
    }

    @Bean
    @ConditionalOnMissingBean
    public ManifestCodec manifestCodec(ObjectMapper om) {
        return new ManifestCodec(om);
    }

    @Bean
    @ConditionalOnMissingBean
    public ManifestValidator manifestValidator(MlStorageProperties props) {
        return new ManifestValidator(props.getSupportedSchemaVersions());
    }

    /**
     * Все LifecycleHooks из контекста (логирование и т.п.) становятся хуками по умолчанию
     * для каждой модели, собранной на этом runtime.
     */
    @Bean
    @ConditionalOnMissingBean
    public ModelRuntime modelRuntime(ArtifactStore artifactStore,
                                     ManifestCodec manifestCodec,
                                     ManifestValidator manifestValidator,
                                     MlStorageProperties props,
                                     ObjectProvider<LifecycleHooks> hooks) {

        List<LifecycleHooks> defaults = hooks.orderedStream().toList();
        Path root = Path.of(props.getModelsDir()).toAbsolutePath().normalize();

        log.info("⚙️ ML runtime: modelsDir={} schemaVersion={} supported={} hooks={}",
                root, props.getSchemaVersion(), props.getSupportedSchemaVersions(), defaults.size());

        return new ModelRuntime(artifactStore, manifestCodec, manifestValidator, root, props.getSchemaVersion(), defaults);
    }

    @Bean
    @ConditionalOnMissingBean(ModelRegistry.class)
    public FileModelRegistry modelRegistry(ObjectMapper om, MlStorageProperties props) {
        return new FileModelRegistry(Path.of(props.getRegistryFile()).toAbsolutePath().normalize(), om);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeployedModelLoader deployedModelLoader(ModelRegistry registry) {
        return new DeployedModelLoader(registry);
    }
}
