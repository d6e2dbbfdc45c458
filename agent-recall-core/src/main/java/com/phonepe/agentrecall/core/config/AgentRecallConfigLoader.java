package com.phonepe.agentrecall.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.agentrecall.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link AgentRecallConfig} as JSON
 */
@Slf4j
public class AgentRecallConfigLoader {
    private final ObjectMapper mapper;

    public AgentRecallConfigLoader() {
        this(JsonUtils.createMapper());
    }

    public AgentRecallConfigLoader(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Loads the file, falling back to defaults when it does not exist
     */
    @SneakyThrows
    public AgentRecallConfig load(@NonNull Path path) {
        if (!Files.exists(path)) {
            log.info("No configuration at {}, using defaults", path);
            return AgentRecallConfig.DEFAULT;
        }
        return mapper.readValue(path.toFile(), AgentRecallConfig.class);
    }

    /**
     * Loads a classpath resource, falling back to defaults when it is absent
     */
    @SneakyThrows
    public AgentRecallConfig loadResource(@NonNull String resource) {
        try (final var in = AgentRecallConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No configuration resource {}, using defaults", resource);
                return AgentRecallConfig.DEFAULT;
            }
            return mapper.readValue(in, AgentRecallConfig.class);
        }
    }

    public List<String> validate(@NonNull AgentRecallConfig config) {
        return config.validate();
    }

    /**
     * @throws IllegalArgumentException listing every problem found
     */
    public AgentRecallConfig loadValidated(@NonNull Path path) {
        final var config = load(path);
        final var errors = validate(config);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration in %s: %s"
                                                       .formatted(path, String.join("; ", errors)));
        }
        return config;
    }

    @SneakyThrows
    public void save(@NonNull AgentRecallConfig config, @NonNull Path path) {
        final var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
        log.debug("Saved configuration to {}", path);
    }
}
