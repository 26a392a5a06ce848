package com.chicu.mlcore.ml.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Все версии одной модели в порядке регистрации.
 */
public record ModelEntry(@JsonProperty("versions") List<ModelVersionInfo> versions) {

    public ModelEntry {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }

    public static ModelEntry empty() {
        return new ModelEntry(List.of());
    }

    ModelEntry append(ModelVersionInfo info) {
        List<ModelVersionInfo> next = new ArrayList<>(versions);
        next.add(info);
        return new ModelEntry(next);
    }

    public Optional<ModelVersionInfo> latest() {
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    /** Самая поздняя регистрация с таким тегом версии. */
    public Optional<ModelVersionInfo> find(String version) {
        for (int i = versions.size() - 1; i >= 0; i--) {
            if (versions.get(i).version().equals(version)) {
                return Optional.of(versions.get(i));
            }
        }
        return Optional.empty();
    }
}
