package com.verolang.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading and writing Vero configuration.
 *
 * <p>Uses Jackson to map {@code vero.yaml} onto {@link VeroConfig}. A missing or invalid file
 * yields {@link VeroConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * VeroConfig config = ConfigLoader.loadFromProject(Paths.get("."));
 * Path out = projectDir.resolve(config.output().directory());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link VeroConfig#defaults()}.
     *
     * @param configPath path to {@code vero.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static VeroConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return VeroConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return VeroConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            VeroConfig config = YAML_MAPPER.readValue(configPath.toFile(), VeroConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return VeroConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return VeroConfig.defaults();
        }
    }

    /**
     * Loads {@code vero.yaml} from a project directory.
     *
     * @param projectDir project root
     * @return loaded configuration or defaults
     */
    public static VeroConfig loadFromProject(Path projectDir) {
        return load(projectDir.resolve(VeroConfig.FILE_NAME));
    }

    /**
     * Writes {@code config} as YAML.
     *
     * @param config configuration to write
     * @param configPath target file, replaced if present
     * @throws IllegalStateException if the file cannot be written
     */
    public static void write(VeroConfig config, Path configPath) {
        try {
            if (configPath.getParent() != null) {
                Files.createDirectories(configPath.getParent());
            }
            YAML_MAPPER.writeValue(configPath.toFile(), config);
            log.debug("Wrote configuration to: {}", configPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write configuration to " + configPath, e);
        }
    }
}
