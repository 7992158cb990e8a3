package com.scout.executor;

import com.scout.common.config.ConfigException;
import com.scout.common.config.InstancePaths;
import com.scout.common.config.ScoutConfig;
import com.scout.executor.cli.CliProcessExecutor;
import com.scout.executor.remote.ControlPlaneExecutor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Picks the session backend from {@code executor.kind}. Called once at startup.
 */
@Slf4j
public final class ExecutorFactory {

    private ExecutorFactory() {
    }

    public static SessionExecutor create(ScoutConfig.ExecutorSettings settings, InstancePaths paths) {
        ScoutConfig.ExecutorSettings s = settings != null ? settings : new ScoutConfig.ExecutorSettings();
        ApprovalMode defaultMode = ApprovalMode.fromString(s.getPermissionMode());
        if (defaultMode == null) {
            throw new ConfigException("Unknown executor.permissionMode: " + s.getPermissionMode());
        }
        String kind = s.getKind() != null ? s.getKind().trim().toLowerCase() : "remote";
        SessionExecutor executor = switch (kind) {
            case "cli" -> {
                Path cwd = s.getCwd() != null ? Path.of(s.getCwd()) : paths.root();
                yield new CliProcessExecutor(s.getCommand(), cwd, defaultMode, s.getModel());
            }
            case "remote" -> {
                String baseUrl = s.getBaseUrl() != null ? s.getBaseUrl() : "http://localhost:" + s.getPort();
                String projectId = s.getProjectId() != null ? s.getProjectId() : paths.projectId();
                yield new ControlPlaneExecutor(baseUrl, projectId, defaultMode);
            }
            default -> throw new ConfigException("Unknown executor.kind: " + s.getKind());
        };
        log.info("Session executor: {} (default mode {})", executor.name(), defaultMode.label());
        return executor;
    }
}
