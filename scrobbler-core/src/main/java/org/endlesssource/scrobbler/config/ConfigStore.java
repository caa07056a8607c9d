package org.endlesssource.scrobbler.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes the TOML configuration file.
 */
public final class ConfigStore {
    private static final Logger logger = LoggerFactory.getLogger(ConfigStore.class);
    private static final TomlMapper MAPPER = TomlMapper.builder()
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private final Path path;

    public ConfigStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    /**
     * {@code ~/.config/now-scrobbler/scrobbler.toml}
     */
    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".config", "now-scrobbler", "scrobbler.toml");
    }

    public Path getPath() {
        return path;
    }

    /**
     * Load and validate the configuration, writing the defaults first when the file does not exist yet.
     */
    public ScrobblerConfig loadOrCreate() throws ConfigException {
        if (!Files.exists(path)) {
            logger.info("Config file not found, creating default at {}", path);
            ScrobblerConfig defaults = ScrobblerConfig.defaults();
            save(defaults);
            return defaults;
        }
        return load();
    }

    public ScrobblerConfig load() throws ConfigException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + path, e);
        }
        ScrobblerConfig config = parse(content);
        logger.debug("Loaded configuration from {}", path);
        return config;
    }

    public void save(ScrobblerConfig config) throws ConfigException {
        Objects.requireNonNull(config, "config must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, format(config), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to write config file " + path, e);
        }
        logger.info("Config saved to {}", path);
    }

    /**
     * Parse and validate TOML text.
     */
    public static ScrobblerConfig parse(String toml) throws ConfigException {
        ScrobblerConfig config;
        try {
            config = MAPPER.readValue(toml, ScrobblerConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to parse config: " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            config = ScrobblerConfig.defaults();
        }
        config.validate();
        return config;
    }

    public static String format(ScrobblerConfig config) throws ConfigException {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to serialize config", e);
        }
    }
}
