package io.vigil.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vigil.core.config.model.VigilConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public VigilConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return VigilConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(VigilConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, VigilConfig.class);
    }

    public void save(Path configPath, VigilConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Path tmp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public VigilConfig writeSection(Path configPath, String section, Object data) throws IOException {
        Objects.requireNonNull(section, "section must not be null");
        if (!VigilConfig.SECTIONS.contains(section)) {
            throw new IllegalArgumentException("unknown config section: " + section);
        }
        ObjectNode current = mapper.valueToTree(load(configPath));
        current.set(section, deepMerge(current.get(section), mapper.valueToTree(data)));

        VigilConfig updated;
        try {
            updated = mapper.treeToValue(current, VigilConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid config section " + section + ": " + e.getOriginalMessage(), e);
        }
        save(configPath, updated);
        LOG.info("Updated config section {} in {}", section, configPath);
        return updated;
    }

    public ConfigWriter writerFor(Path configPath) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        return (section, data) -> writeSection(configPath, section, data);
    }

    public String toPrettyJson(VigilConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
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
