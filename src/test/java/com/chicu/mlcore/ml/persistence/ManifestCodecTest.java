package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.common.enums.ModelStatus;
import com.chicu.mlcore.ml.error.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestCodecTest {

    @TempDir
    Path dir;

    private final ManifestCodec codec = new ManifestCodec(new ObjectMapper());

    @Test
    void write_shouldUseSnakeCaseAndLowercaseEnums() throws Exception {
        ModelManifest m = ModelManifest.builder()
                .schemaVersion("1.1")
                .modelId("m1")
                .modelType("dbscan")
                .version("1.0.0")
                .createdAt(Instant.parse("2024-03-01T10:15:30Z"))
                .status(ModelStatus.TRAINED)
                .trainingSamples(90)
                .artifacts(List.of(new ArtifactSpec("params", "params.json", "ab".repeat(32), 10, ArtifactType.JSON)))
                .build();
        Path file = dir.resolve("manifest.json");

        codec.write(m, file);
        String json = Files.readString(file);

        assertTrue(json.contains("\"schema_version\""));
        assertTrue(json.contains("\"training_samples\" : 90"));
        assertTrue(json.contains("\"status\" : \"trained\""));
        assertTrue(json.contains("\"artifact_type\" : \"json\""));
        assertTrue(json.contains("2024-03-01T10:15:30Z"));

        ModelManifest back = codec.read(file);
        assertEquals(m.getCreatedAt(), back.getCreatedAt());
        assertEquals(ModelStatus.TRAINED, back.getStatus());
        assertEquals(m.getArtifacts(), back.getArtifacts());
    }

    @Test
    void read_shouldIgnoreUnknownFields() throws Exception {
        Path file = dir.resolve("manifest.json");
        Files.writeString(file, """
                {"schema_version":"1.0","model_id":"m1","model_type":"dbscan","version":"1",
                 "created_at":"2024-01-01T00:00:00Z","status":"trained","artifacts":[],
                 "hyperparameters":{"eps":0.5},"performance_metrics":{},"training_samples":90,
                 "dependencies":{},"input_schema_version":null,"legacy_field":true}
                """);

        ModelManifest m = codec.read(file);

        assertEquals("1.0", m.getSchemaVersion());
        assertEquals(Map.of("eps", 0.5), m.getHyperparameters());
    }

    @Test
    void read_brokenJson_shouldThrowValidation() throws Exception {
        Path file = dir.resolve("manifest.json");
        Files.writeString(file, "{\"model_id\": ");

        assertThrows(ValidationException.class, () -> codec.read(file));
    }

    @Test
    void read_missingKeys_shouldListEveryOneOfThem() throws Exception {
        Path file = dir.resolve("manifest.json");
        Files.writeString(file, """
                {"schema_version":"1.1","model_id":"m1","model_type":"dbscan","version":"1",
                 "created_at":"2024-01-01T00:00:00Z","status":"trained"}
                """);

        ValidationException e = assertThrows(ValidationException.class, () -> codec.read(file));

        assertEquals(
                List.of("hyperparameters", "performance_metrics", "training_samples",
                        "artifacts", "dependencies", "input_schema_version"),
                e.getContext().get("missing_fields"));
    }

    @Test
    void read_nullForRequiredKey_shouldThrowValidation() throws Exception {
        Path file = dir.resolve("manifest.json");
        Files.writeString(file, """
                {"schema_version":"1.1","model_id":"m1","model_type":"dbscan","version":"1",
                 "created_at":"2024-01-01T00:00:00Z","status":"trained","artifacts":null,
                 "hyperparameters":{},"performance_metrics":{},"training_samples":3,
                 "dependencies":{},"input_schema_version":null}
                """);

        ValidationException e = assertThrows(ValidationException.class, () -> codec.read(file));

        assertEquals(List.of("artifacts"), e.getContext().get("missing_fields"));
    }

    @Test
    void write_shouldKeepNullInputSchemaVersionKey() throws Exception {
        ModelManifest m = ModelManifest.builder()
                .schemaVersion("1.1").modelId("m1").modelType("dbscan").version("1")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z")).status(ModelStatus.TRAINED)
                .build();
        Path file = dir.resolve("manifest.json");

        codec.write(m, file);

        assertTrue(Files.readString(file).contains("\"input_schema_version\" : null"));
        assertNull(codec.read(file).getInputSchemaVersion());
    }
}
