package com.chicu.mlcore.ml.verification;

import com.chicu.mlcore.ml.core.MeanOffsetModel;
import com.chicu.mlcore.ml.core.ModelRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ModelTestSuiteTest {

    @TempDir
    Path root;

    private ModelRuntime runtime;
    private final ModelTestSuite suite = new ModelTestSuite(new PersistenceVerifier(new ObjectMapper()));

    @BeforeEach
    void setUp() {
        runtime = ModelRuntime.standalone(root);
    }

    @Test
    void runAll_trainedModel_shouldPassPersistence() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");
        m.train(new double[]{1.0, 2.0, 3.0, 6.0});

        SuiteReport report = suite.runAll(m, () -> new MeanOffsetModel(runtime, "m1"),
                new double[]{0.5, 4.0}, root.resolve("suite"));

        assertTrue(report.allPassed());
        assertEquals("m1", report.modelId());
        assertEquals(MeanOffsetModel.TYPE, report.modelType());
        assertTrue(report.tests().get(ModelTestSuite.PERSISTENCE).passed());
    }

    @Test
    void runAll_untrainedModel_shouldFail() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        SuiteReport report = suite.runAll(m, () -> new MeanOffsetModel(runtime, "m1"),
                new double[]{1.0}, root.resolve("suite"));

        assertFalse(report.allPassed());
        assertNotNull(report.tests().get(ModelTestSuite.PERSISTENCE).error());
    }

    @Test
    void runAll_withoutTestData_shouldRunNothing() {
        MeanOffsetModel m = new MeanOffsetModel(runtime, "m1");

        SuiteReport report = suite.runAll(m, () -> new MeanOffsetModel(runtime, "m1"), null, root.resolve("suite"));

        assertTrue(report.tests().isEmpty());
        assertTrue(report.allPassed());
    }
}
