package com.chicu.mlcore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "ml.storage")
public class MlStorageProperties {

    private String modelsDir = "./ml-models";

    private String registryFile = "./ml-models/registry.json";

    /** версия схемы, которую пишет save() */
    private String schemaVersion = "1.1";

    /** версии, которые принимает load() */
    private Set<String> supportedSchemaVersions = new LinkedHashSet<>(List.of("1.0", "1.1"));
}
