package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.common.enums.ModelStatus;
import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestValidatorTest {

    @TempDir
    Path dir;

    private final ArtifactStore store = new ArtifactStore(new ObjectMapper());
    private final ManifestValidator validator = new ManifestValidator(ModelManifest.SUPPORTED_SCHEMA_VERSIONS);

    private ModelManifest manifest;

    @BeforeEach
    void setUp() {
        ArtifactSpec spec = store.save(new double[]{1.0, 2.0}, dir.resolve("weights.bin"), ArtifactType.BINARY, "weights");
        manifest = ModelManifest.builder()
                .schemaVersion("1.1")
                .modelId("m1")
                .modelType("dbscan")
                .version("1.0.0")
                .createdAt(Instant.now())
                .status(ModelStatus.TRAINED)
                .artifacts(new ArrayList<>(List.of(spec)))
                .build();
    }

    @Test
    void validManifest_shouldPass() {
        assertDoesNotThrow(() -> validator.validate(manifest, dir));
    }

    @Test
    void olderSupportedSchema_shouldPass() {
        manifest.setSchemaVersion("1.0");

        assertDoesNotThrow(() -> validator.validate(manifest, dir));
    }

    @Test
    void missingStatus_shouldThrowValidation() {
        manifest.setStatus(null);

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(manifest, dir));

        assertEquals(ErrorCode.VALIDATION_ERROR, e.getCode());
        assertEquals(List.of("status"), e.getContext().get("missing_fields"));
    }

    @Test
    void missingModelId_shouldThrowValidation() {
        manifest.setModelId(" ");

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(manifest, dir));
        assertEquals(List.of("model_id"), e.getContext().get("missing_fields"));
    }

    @Test
    void unsupportedSchema_shouldThrowIncompatibleVersion() {
        manifest.setSchemaVersion("2.0");

        PersistenceException e = assertThrows(PersistenceException.class, () -> validator.validate(manifest, dir));

        assertEquals(ErrorCode.INCOMPATIBLE_VERSION, e.getCode());
        assertEquals("2.0", e.getContext().get("schema_version"));
    }

    @Test
    void tamperedArtifact_shouldThrowChecksumMismatch() throws Exception {
        Files.write(dir.resolve("weights.bin"), new byte[16]);

        PersistenceException e = assertThrows(PersistenceException.class, () -> validator.validate(manifest, dir));

        assertEquals(ErrorCode.CHECKSUM_MISMATCH, e.getCode());
        assertEquals(manifest.getArtifacts().get(0).checksum(), e.getContext().get("expected"));
        assertNotEquals(e.getContext().get("expected"), e.getContext().get("actual"));
    }

    @Test
    void deletedArtifact_shouldThrowMissingArtifact() throws Exception {
        Files.delete(dir.resolve("weights.bin"));

        PersistenceException e = assertThrows(PersistenceException.class, () -> validator.validate(manifest, dir));

        assertEquals(ErrorCode.MISSING_ARTIFACT, e.getCode());
        assertEquals("weights", e.getContext().get("artifact"));
    }

    @Test
    void duplicateArtifactName_shouldThrowValidation() {
        manifest.getArtifacts().add(manifest.getArtifacts().get(0));

        assertThrows(ValidationException.class, () -> validator.validate(manifest, dir));
    }

    @Test
    void filenameEscapingDirectory_shouldThrowValidation() {
        ArtifactSpec s = manifest.getArtifacts().get(0);
        manifest.setArtifacts(new ArrayList<>(List.of(
                new ArtifactSpec(s.name(), "../weights.bin", s.checksum(), s.sizeBytes(), s.artifactType()))));

        assertThrows(ValidationException.class, () -> validator.validate(manifest, dir));
    }

    @Test
    void unsupportedSchema_shouldWinOverBrokenArtifactEntries() {
        manifest.setSchemaVersion("2.0");
        manifest.getArtifacts().add(manifest.getArtifacts().get(0));

        PersistenceException e = assertThrows(PersistenceException.class, () -> validator.validate(manifest, dir));

        assertEquals(ErrorCode.INCOMPATIBLE_VERSION, e.getCode());
    }

    @Test
    void missingDependencies_shouldThrowValidation() {
        manifest.setDependencies(null);

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(manifest, dir));

        assertEquals(List.of("dependencies"), e.getContext().get("missing_fields"));
    }
}
