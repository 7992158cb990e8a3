package com.scout.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instance {@code .env} loading.
 * <p>
 * Lookups consult the instance file first and fall back to the process
 * environment, so one machine can host several instances with different
 * credentials.
 */
public final class DotEnv {

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    private final Map<String, String> fileVars;
    private final Map<String, String> processEnv;

    private DotEnv(Map<String, String> fileVars, Map<String, String> processEnv) {
        this.fileVars = fileVars;
        this.processEnv = processEnv;
    }

    /**
     * Load an instance {@code .env}; a missing file yields an empty overlay.
     */
    public static DotEnv load(Path envFile) {
        return load(envFile, System.getenv());
    }

    public static DotEnv load(Path envFile, Map<String, String> processEnv) {
        Map<String, String> vars = parseEnvFile(envFile);
        if (!vars.isEmpty()) {
            log.debug("dotenv: loaded {} vars from {}", vars.size(), envFile);
        }
        return new DotEnv(vars, processEnv);
    }

    /**
     * Value from the instance file, then the process environment.
     *
     * @return the value, or null when neither defines a non-blank one
     */
    public String get(String key) {
        String value = fileVars.get(key);
        if (value != null && !value.isBlank()) {
            return value;
        }
        value = processEnv.get(key);
        return value != null && !value.isBlank() ? value : null;
    }

    public Map<String, String> fileVars() {
        return Collections.unmodifiableMap(fileVars);
    }

    /**
     * Parse a .env file into key-value pairs.
     * Supports: KEY=value, KEY="quoted value", KEY='quoted value', export
     * KEY=value.
     * Lines starting with # are comments.
     */
    public static Map<String, String> parseEnvFile(Path path) {
        Map<String, String> result = new LinkedHashMap<>();
        if (path == null || !Files.exists(path)) {
            return result;
        }
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("export ")) {
                    trimmed = trimmed.substring(7).trim();
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                String key = trimmed.substring(0, eq).trim();
                String value = trimmed.substring(eq + 1).trim();
                if (value.length() >= 2) {
                    if ((value.startsWith("\"") && value.endsWith("\""))
                            || (value.startsWith("'") && value.endsWith("'"))) {
                        value = value.substring(1, value.length() - 1);
                    }
                }
                if (!key.isEmpty()) {
                    result.put(key, value);
                }
            }
        } catch (IOException e) {
            log.warn("dotenv: failed to read {}: {}", path, e.getMessage());
        }
        return result;
    }
}
