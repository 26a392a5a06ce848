package com.chicu.mlcore.ml.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * registry.json:
 * <pre>
 * { "models":      { type: { id: { "versions": [...] } } },
 *   "deployments": { name: { type: { model_id, version, deployed_at, model_path } } } }
 * </pre>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryDocument {

    @JsonProperty("models")
    private Map<String, Map<String, ModelEntry>> models = new TreeMap<>();

    @JsonProperty("deployments")
    private Map<String, Map<String, DeploymentInfo>> deployments = new TreeMap<>();

    /** Копия обоих уровней карт; ModelEntry и DeploymentInfo неизменяемые и переиспользуются. */
    public RegistryDocument copy() {
        RegistryDocument next = new RegistryDocument();
        if (models != null) {
            models.forEach((type, byId) -> next.models.put(type, new TreeMap<>(byId)));
        }
        if (deployments != null) {
            deployments.forEach((name, byType) -> next.deployments.put(name, new TreeMap<>(byType)));
        }
        return next;
    }
}
