package com.chicu.mlcore.ml.registry;

import com.chicu.mlcore.ml.core.MeanOffsetModel;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DeployedModelLoaderTest {

    private static final double[] DATA = {2.0, 4.0, 6.0, 8.0};

    @TempDir
    Path root;

    private FileModelRegistry registry;
    private ModelRuntime runtime;
    private DeployedModelLoader loader;

    @BeforeEach
    void setUp() {
        registry = new FileModelRegistry(root.resolve("registry.json"), new ObjectMapper());
        runtime = ModelRuntime.standalone(root.resolve("models"))
                .withHooks(new RegistryPublishingHooks(registry, ModelRuntime.standalone(root).manifestCodec(), "production"));
        loader = new DeployedModelLoader(registry);
    }

    @Test
    void saveWithPublishingHooks_shouldRegisterAndDeploy() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);

        Path dir = m.save();

        ModelVersionInfo latest = registry.getLatestVersion(MeanOffsetModel.TYPE, "m1").orElseThrow();
        assertEquals("1.0.0", latest.version());
        assertEquals(dir.toString(), latest.modelPath());
        assertEquals(4, latest.trainingSamples());
        assertEquals("1.0.0", registry.getDeployedModel(MeanOffsetModel.TYPE).orElseThrow().version());
    }

    @Test
    void load_shouldRestoreDeployedVersion() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);
        m.save();
        double expected = m.predict(new double[]{1.0}).predictions().get(0);

        MeanOffsetModel loaded = loader.load(MeanOffsetModel.TYPE, d -> new MeanOffsetModel(runtime, d.modelId()));

        assertTrue(loaded.isTrained());
        assertEquals("m1", loaded.getModelId());
        assertEquals(expected, loaded.predict(new double[]{1.0}).predictions().get(0), 1e-12);
    }

    @Test
    void load_shouldFollowRedeploy() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);
        m.save();
        m.supersede("2.0.0");
        m.train(new double[]{10.0, 20.0, 30.0});
        m.save();

        assertEquals("2.0.0", loader.load(MeanOffsetModel.TYPE, d -> new MeanOffsetModel(runtime, d.modelId())).getVersion());

        assertTrue(registry.deploy(MeanOffsetModel.TYPE, "m1", "1.0.0"));
        assertEquals("1.0.0", loader.load(MeanOffsetModel.TYPE, d -> new MeanOffsetModel(runtime, d.modelId())).getVersion());
    }

    @Test
    void load_withoutDeployment_shouldThrowMissingArtifact() {
        PersistenceException e = assertThrows(PersistenceException.class,
                () -> loader.load("dbscan", "staging", d -> new MeanOffsetModel(runtime, d.modelId())));

        assertEquals(ErrorCode.MISSING_ARTIFACT, e.getCode());
        assertEquals("staging", e.getContext().get("deployment"));
    }
}
