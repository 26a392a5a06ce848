package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Каноническая JSON-форма манифеста: snake_case, ISO-8601, с отступами.
 * <p>
 * read() сначала проверяет набор ключей по дереву JSON: дефолты {@link ModelManifest}
 * иначе молча подставили бы пустые коллекции вместо отсутствующих полей.
 */
public class ManifestCodec {

    public static final String MANIFEST_FILE = "manifest.json";

    private final ObjectMapper mapper;

    public ManifestCodec(ObjectMapper base) {
        this.mapper = base.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.ALWAYS);
    }

    public void write(ModelManifest manifest, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), manifest);
        } catch (IOException e) {
            throw new PersistenceException(
                    "Не удалось записать манифест: " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("path", file.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }
    }

    public ModelManifest read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new PersistenceException(
                    "Манифест не найден: " + file,
                    ErrorCode.MISSING_ARTIFACT,
                    Map.of("path", file.toString(), "artifact", MANIFEST_FILE)
            );
        }
        try {
            JsonNode tree = mapper.readTree(file.toFile());
            if (tree == null || !tree.isObject()) {
                throw new ValidationException("Манифест пустой или не JSON-объект", Map.of("path", file.toString()));
            }
            checkRequiredKeys(tree, file);
            return mapper.treeToValue(tree, ModelManifest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                    "Манифест не разбирается: " + e.getOriginalMessage(),
                    Map.of("path", file.toString(), "cause", String.valueOf(e.getOriginalMessage())),
                    e
            );
        } catch (IOException e) {
            throw new PersistenceException(
                    "Не удалось прочитать манифест: " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("path", file.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }
    }

    private static void checkRequiredKeys(JsonNode tree, Path file) {
        List<String> missing = new ArrayList<>();
        for (String key : ModelManifest.REQUIRED_FIELDS) {
            JsonNode value = tree.get(key);
            if (value == null || (value.isNull() && !ModelManifest.NULLABLE_FIELDS.contains(key))) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException(
                    "В манифесте нет обязательных полей: " + missing,
                    Map.of("path", file.toString(), "missing_fields", List.copyOf(missing))
            );
        }
    }

    public String toJson(ModelManifest manifest) {
        try {
            return mapper.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Манифест не сериализуется: " + e.getOriginalMessage(), Map.of(), e);
        }
    }
}
