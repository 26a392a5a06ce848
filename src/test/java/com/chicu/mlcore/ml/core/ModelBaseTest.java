package com.chicu.mlcore.ml.core;

import com.chicu.mlcore.common.enums.ModelStatus;
import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.PredictionException;
import com.chicu.mlcore.ml.error.TrainingException;
import com.chicu.mlcore.ml.error.ValidationException;
import com.chicu.mlcore.ml.lifecycle.LifecycleContext;
import com.chicu.mlcore.ml.lifecycle.LifecycleHooks;
import com.chicu.mlcore.ml.persistence.ArtifactSpec;
import com.chicu.mlcore.ml.persistence.ModelKeyFactory;
import com.chicu.mlcore.ml.persistence.ModelManifest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelBaseTest {

    private static final double[] DATA = {1.0, 2.0, 3.0, 6.0};

    @TempDir
    Path root;

    private ModelRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = ModelRuntime.standalone(root);
    }

    @Test
    void newModel_shouldStartInitialized() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        assertEquals(ModelStatus.INITIALIZED, m.getStatus());
        assertFalse(m.isTrained());
        ModelManifest mf = m.manifest();
        assertEquals(ModelManifest.CURRENT_SCHEMA_VERSION, mf.getSchemaVersion());
        assertNotNull(mf.getCreatedAt());
        assertTrue(mf.getArtifacts().isEmpty());
        assertEquals("mean", mf.getHyperparameters().get("offset_mode"));
    }

    @Test
    void train_shouldMoveToTrained_andRecordMetrics() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        TrainingResult r = m.train(DATA);

        assertTrue(r.success());
        assertNull(r.error());
        assertEquals(4.0, r.metrics().get("training_samples"));
        assertEquals(3.0, r.metrics().get("mean"), 1e-12);
        assertEquals(ModelStatus.TRAINED, m.getStatus());
        assertTrue(m.isTrained());
        assertEquals(4, r.manifest().getTrainingSamples());
        assertNotNull(r.manifest().getTrainedAt());
        assertTrue(r.manifest().getArtifacts().isEmpty(), "artifacts заполняются только в save()");
    }

    @Test
    void train_shouldRejectTooFewSamples_withoutTouchingStatus() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        TrainingException e = assertThrows(TrainingException.class, () -> m.train(new double[]{1.0, 2.0}));

        assertEquals(ErrorCode.TRAINING_FAILED, e.getCode());
        assertEquals(2, e.getContext().get("samples"));
        assertEquals(3, e.getContext().get("required"));
        assertEquals(ModelStatus.INITIALIZED, m.getStatus());
        assertFalse(m.isTrained());
    }

    @Test
    void train_shouldRejectMissingDependency_beforeFitting() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.missingDependency = "org.example.absent.Library";

        TrainingException e = assertThrows(TrainingException.class, () -> m.train(DATA));

        assertEquals("org.example.absent.Library", e.getContext().get("dependency"));
        assertEquals(ModelStatus.INITIALIZED, m.getStatus());
    }

    @Test
    void train_shouldMarkFailed_andWrapCause_whenFitThrows() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.failOnFit(new IllegalStateException("matrix is singular"));

        TrainingException e = assertThrows(TrainingException.class, () -> m.train(DATA));

        assertEquals(ModelStatus.FAILED, m.getStatus());
        assertFalse(m.isTrained());
        assertEquals("matrix is singular", e.getContext().get("cause"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void train_afterFailure_shouldBeAllowedAgain() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.failOnFit(new IllegalStateException("boom"));
        assertThrows(TrainingException.class, () -> m.train(DATA));

        m.failOnFit(null);
        m.train(DATA);

        assertEquals(ModelStatus.TRAINED, m.getStatus());
        assertTrue(m.isTrained());
    }

    @Test
    void train_errorFromLibrary_shouldMarkFailed_andRethrowAsIs() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);
        List<String> rollbacks = new ArrayList<>();
        m.addHooks(new LifecycleHooks() {
            @Override
            public void onRollback(LifecycleContext ctx) {
                rollbacks.add(String.valueOf(ctx.payload().get("error_code")));
            }
        });
        m.failOnFit(new StackOverflowError("deep recursion in fit"));

        assertThrows(StackOverflowError.class, () -> m.train(DATA));

        assertEquals(ModelStatus.FAILED, m.getStatus());
        assertFalse(m.isTrained());
        assertThrows(PredictionException.class, () -> m.predict(DATA));
        assertEquals(List.of("TRAINING_FAILED"), rollbacks);
    }

    @Test
    void train_nullData_shouldFailFast() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        assertThrows(TrainingException.class, () -> m.train(null));
        assertEquals(ModelStatus.INITIALIZED, m.getStatus());
    }

    @Test
    void predict_beforeTrain_shouldThrow() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        PredictionException e = assertThrows(PredictionException.class, () -> m.predict(DATA));
        assertEquals(ErrorCode.PREDICTION_FAILED, e.getCode());
    }

    @Test
    void save_beforeTrain_shouldThrow() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        PersistenceException e = assertThrows(PersistenceException.class, m::save);
        assertEquals(ErrorCode.PERSISTENCE_ERROR, e.getCode());
        assertFalse(Files.exists(m.defaultDirectory()));
    }

    @Test
    void save_shouldWriteManifestAndArtifacts_underDefaultLayout() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);

        Path dir = m.save();

        assertEquals(root.resolve(MeanOffsetModel.TYPE).resolve("m1").resolve("1.0.0"), dir);
        assertTrue(Files.isRegularFile(ModelKeyFactory.manifestFile(dir)));
        assertTrue(Files.isRegularFile(ModelKeyFactory.artifactsDir(dir).resolve("state.bin")));

        List<ArtifactSpec> artifacts = m.manifest().getArtifacts();
        assertEquals(1, artifacts.size());
        assertEquals("state", artifacts.get(0).name());
        assertEquals(64, artifacts.get(0).checksum().length());
    }

    @Test
    void save_twice_shouldNotAccumulateArtifacts() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);

        m.save();
        Path dir = m.save();

        assertEquals(1, m.manifest().getArtifacts().size());
        ModelManifest onDisk = runtime.manifestCodec().read(ModelKeyFactory.manifestFile(dir));
        assertEquals(1, onDisk.getArtifacts().size());
    }

    @Test
    void load_shouldRestoreState_intoFreshInstance() {
        MeanOffsetModel trained = new MeanOffsetModel(runtime, "m1");
        trained.train(DATA);
        Path dir = trained.save();

        MeanOffsetModel fresh = new MeanOffsetModel(runtime, "m1");
        fresh.load(dir);

        assertTrue(fresh.isTrained());
        assertEquals(ModelStatus.TRAINED, fresh.getStatus());
        assertEquals(3.0, fresh.mean(), 0.0);
        assertEquals(trained.predict(DATA).predictions(), fresh.predict(DATA).predictions());
        assertEquals(4, fresh.manifest().getTrainingSamples());
    }

    @Test
    void load_missingManifest_shouldThrowMissingArtifact() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        PersistenceException e = assertThrows(PersistenceException.class, () -> m.load(root.resolve("nothing")));

        assertEquals(ErrorCode.MISSING_ARTIFACT, e.getCode());
        assertFalse(m.isTrained());
    }

    @Test
    void load_tamperedArtifact_shouldFailClosed() throws Exception {
        MeanOffsetModel trained = new MeanOffsetModel(runtime, "m1");
        trained.train(DATA);
        Path dir = trained.save();
        Files.write(ModelKeyFactory.artifactsDir(dir).resolve("state.bin"), new byte[]{0, 0, 0, 0, 0, 0, 0, 0});

        MeanOffsetModel fresh = new MeanOffsetModel(runtime, "m1");
        PersistenceException e = assertThrows(PersistenceException.class, () -> fresh.load(dir));

        assertEquals(ErrorCode.CHECKSUM_MISMATCH, e.getCode());
        assertFalse(fresh.isTrained());
        assertEquals(ModelStatus.INITIALIZED, fresh.getStatus());
    }

    @Test
    void load_otherModelType_shouldThrowValidation() {
        MeanOffsetModel trained = new MeanOffsetModel(runtime, "m1");
        trained.train(DATA);
        Path dir = trained.save();

        ModelManifest mf = runtime.manifestCodec().read(ModelKeyFactory.manifestFile(dir));
        mf.setModelType("other_type");
        runtime.manifestCodec().write(mf, ModelKeyFactory.manifestFile(dir));

        MeanOffsetModel fresh = new MeanOffsetModel(runtime, "m1");
        assertThrows(ValidationException.class, () -> fresh.load(dir));
        assertFalse(fresh.isTrained());
    }

    @Test
    void load_manifestWithoutRequiredArtifact_shouldThrowMissingArtifact() {
        MeanOffsetModel trained = new MeanOffsetModel(runtime, "m1");
        trained.train(DATA);
        Path dir = trained.save();

        ModelManifest mf = runtime.manifestCodec().read(ModelKeyFactory.manifestFile(dir));
        mf.setArtifacts(new ArrayList<>());
        runtime.manifestCodec().write(mf, ModelKeyFactory.manifestFile(dir));

        MeanOffsetModel fresh = new MeanOffsetModel(runtime, "m1");
        PersistenceException e = assertThrows(PersistenceException.class, () -> fresh.load(dir));

        assertEquals(ErrorCode.MISSING_ARTIFACT, e.getCode());
        assertEquals(List.of("state"), e.getContext().get("missing_artifacts"));
    }

    @Test
    void load_manifestWithoutRequiredKeys_shouldThrowValidation() throws Exception {
        MeanOffsetModel trained = new MeanOffsetModel(runtime, "m1");
        trained.train(DATA);
        Path dir = trained.save();

        Path file = ModelKeyFactory.manifestFile(dir);
        ObjectNode json = (ObjectNode) new ObjectMapper().readTree(file.toFile());
        json.remove(List.of("hyperparameters", "performance_metrics", "training_samples", "dependencies"));
        Files.writeString(file, json.toString());

        MeanOffsetModel fresh = new MeanOffsetModel(runtime, "m1");
        ValidationException e = assertThrows(ValidationException.class, () -> fresh.load(dir));

        assertEquals(List.of("hyperparameters", "performance_metrics", "training_samples", "dependencies"),
                e.getContext().get("missing_fields"));
        assertFalse(fresh.isTrained());
    }

    @Test
    void load_manifestWithoutArtifactsKey_shouldThrowValidation() throws Exception {
        MeanOffsetModel trained = new MeanOffsetModel(runtime, "m1");
        trained.train(DATA);
        Path dir = trained.save();

        Path file = ModelKeyFactory.manifestFile(dir);
        ObjectNode json = (ObjectNode) new ObjectMapper().readTree(file.toFile());
        json.remove("artifacts");
        Files.writeString(file, json.toString());

        MeanOffsetModel fresh = new MeanOffsetModel(runtime, "m1");
        ValidationException e = assertThrows(ValidationException.class, () -> fresh.load(dir));

        assertEquals(List.of("artifacts"), e.getContext().get("missing_fields"));
    }

    @Test
    void load_failingConversion_shouldLeavePreviousStateUntouched() {
        MeanOffsetModel source = new MeanOffsetModel(runtime, "m1", true);
        source.train(DATA);
        Path dir = source.save();

        MeanOffsetModel target = new MeanOffsetModel(runtime, "m1", true);
        target.train(new double[]{10.0, 10.0, 10.0});
        target.notesRestoreFailure = new IllegalStateException("corrupt notes");

        assertThrows(PersistenceException.class, () -> target.load(dir));

        assertEquals(10.0, target.mean(), 0.0);
        assertTrue(target.isTrained());
        assertEquals(3, target.manifest().getTrainingSamples());
    }

    @Test
    void load_unknownArtifact_shouldBeSkipped() {
        MeanOffsetModel withNotes = new MeanOffsetModel(runtime, "m1", true);
        withNotes.train(DATA);
        Path dir = withNotes.save();
        assertEquals(2, withNotes.manifest().getArtifacts().size());

        MeanOffsetModel plain = new MeanOffsetModel(runtime, "m1");
        plain.load(dir);

        assertTrue(plain.isTrained());
        assertEquals(3.0, plain.mean(), 0.0);
    }

    @Test
    void supersede_shouldStartNewVersion_andKeepOldSnapshotIntact() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);
        m.save();
        ModelManifest before = m.manifest();

        m.supersede("2.0.0");

        assertEquals("2.0.0", m.getVersion());
        assertEquals(ModelStatus.INITIALIZED, m.getStatus());
        assertFalse(m.isTrained());
        assertTrue(m.manifest().getArtifacts().isEmpty());
        assertEquals("mean", m.manifest().getHyperparameters().get("offset_mode"));

        assertEquals("1.0.0", before.getVersion());
        assertEquals(1, before.getArtifacts().size());
    }

    @Test
    void manifest_shouldReturnDetachedCopy() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.manifest().getHyperparameters().put("hacked", true);

        assertFalse(m.manifest().getHyperparameters().containsKey("hacked"));
    }

    @Test
    void info_shouldSummarizeModel() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(DATA);

        Map<String, Object> info = m.info();

        assertEquals("m1", info.get("model_id"));
        assertEquals(MeanOffsetModel.TYPE, info.get("model_type"));
        assertEquals(true, info.get("is_trained"));
        assertEquals("trained", info.get("status"));
        assertTrue(((Map<?, ?>) info.get("performance_metrics")).containsKey("training_samples"));
    }

    @Test
    void fingerprint_shouldBeTypeIdVersion() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "Orders");

        assertEquals("mean_offset|orders|1.0.0", m.fingerprint());
    }
}
