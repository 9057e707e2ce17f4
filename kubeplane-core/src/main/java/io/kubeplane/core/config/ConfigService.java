package io.kubeplane.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kubeplane.core.config.model.KubeplaneConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public KubeplaneConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KubeplaneConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(KubeplaneConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        if (existingNode == null || existingNode.isMissingNode()) {
            return KubeplaneConfig.defaults();
        }
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, KubeplaneConfig.class);
    }

    public void save(Path configPath, KubeplaneConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null || base.isNull()) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
