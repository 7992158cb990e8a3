package com.scout.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Loads and caches the instance {@code config.yaml}.
 * <p>
 * The cache only collapses bursts of reads inside one tick; it expires quickly
 * so edits made by hand are picked up on the next tick without a restart.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);

    private final ObjectMapper yamlMapper;
    private final Cache<String, ScoutConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this.configPath = configPath;
        this.yamlMapper = createYamlMapper();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    public static ObjectMapper createYamlMapper() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
        return new ObjectMapper(factory)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path getConfigPath() {
        return configPath;
    }

    public boolean exists() {
        return Files.exists(configPath);
    }

    /**
     * Load config with caching.
     *
     * @throws ConfigException if the file is missing or malformed
     */
    public ScoutConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ScoutConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Read the raw document tree. Never cached: callers edit and save it back.
     */
    public ObjectNode loadTree() {
        try {
            JsonNode root = yamlMapper.readTree(configPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                return yamlMapper.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigException("Config root is not a mapping: " + configPath);
            }
            return (ObjectNode) root;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + configPath, e);
        }
    }

    /**
     * Write a document tree back to disk, replacing the file atomically.
     */
    public void saveTree(ObjectNode tree) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = parent.resolve(configPath.getFileName() + ".tmp");
            yamlMapper.writeValue(tmp.toFile(), tree);
            Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ConfigException("Failed to save config: " + configPath, e);
        } finally {
            cache.invalidateAll();
        }
        log.debug("Config saved to: {}", configPath);
    }

    public ObjectMapper getYamlMapper() {
        return yamlMapper;
    }

    private ScoutConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            throw new ConfigException("Config file not found: " + configPath);
        }
        try {
            ScoutConfig config = yamlMapper.readValue(configPath.toFile(), ScoutConfig.class);
            return config != null ? config : new ScoutConfig();
        } catch (IOException e) {
            throw new ConfigException("Failed to parse config: " + configPath, e);
        }
    }
}
