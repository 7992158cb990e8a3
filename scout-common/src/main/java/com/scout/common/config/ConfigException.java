package com.scout.common.config;

/**
 * Configuration problem that is fatal to the single operation that hit it:
 * a malformed cron expression, an unknown schedule name, an unreadable
 * {@code config.yaml}.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
