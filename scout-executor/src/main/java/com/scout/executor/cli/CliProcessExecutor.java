package com.scout.executor.cli;

import com.scout.common.infra.ErrorUtils;
import com.scout.executor.ApprovalMode;
import com.scout.executor.ExecutorException;
import com.scout.executor.SessionExecutor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each session as its own agent CLI process in print mode.
 * <p>
 * The process for a session id is the lock on that session: a resume is
 * refused while the previous process for the id is still alive.
 */
@Slf4j
public class CliProcessExecutor implements SessionExecutor {

    private final String command;
    private final Path defaultCwd;
    private final ApprovalMode defaultMode;
    private final String model;
    private final ProcessLauncher launcher;
    private final Map<String, Process> processes = new ConcurrentHashMap<>();

    public CliProcessExecutor(String command, Path defaultCwd, ApprovalMode defaultMode, String model) {
        this(command, defaultCwd, defaultMode, model, ProcessLauncher.system());
    }

    public CliProcessExecutor(String command, Path defaultCwd, ApprovalMode defaultMode, String model,
            ProcessLauncher launcher) {
        this.command = command;
        this.defaultCwd = defaultCwd;
        this.defaultMode = defaultMode != null ? defaultMode : ApprovalMode.BYPASS;
        this.model = model;
        this.launcher = launcher;
    }

    @Override
    public String name() {
        return "cli";
    }

    @Override
    public StartResult start(String message, SessionOptions options) throws ExecutorException {
        String sessionId = UUID.randomUUID().toString();
        try {
            Process process = spawn(List.of("--session-id", sessionId), message, options);
            processes.put(sessionId, process);
        } catch (IOException e) {
            throw new ExecutorException("Failed to spawn " + command + ": " + ErrorUtils.formatErrorMessage(e), e);
        }
        log.info("Started CLI session {}", sessionId);
        return new StartResult(sessionId, StartStatus.STARTED);
    }

    @Override
    public boolean resume(String sessionId, String message, SessionOptions options) {
        Process existing = processes.get(sessionId);
        if (existing != null && existing.isAlive()) {
            log.warn("Cannot resume {}: previous run still alive", sessionId);
            return false;
        }
        try {
            Process process = spawn(List.of("--resume", sessionId), message, options);
            processes.put(sessionId, process);
            log.info("Resumed CLI session {}", sessionId);
            return true;
        } catch (IOException e) {
            log.warn("Failed to resume {}: {}", sessionId, ErrorUtils.formatErrorMessage(e));
            return false;
        }
    }

    @Override
    public PollResult poll(String sessionId) {
        Process process = processes.get(sessionId);
        if (process == null) {
            return PollResult.error("unknown session");
        }
        if (process.isAlive()) {
            return PollResult.running();
        }
        int exitCode = process.exitValue();
        return exitCode == 0 ? PollResult.done() : PollResult.error("exit code " + exitCode);
    }

    @Override
    public void cleanup(String sessionId) {
        Process process = processes.remove(sessionId);
        if (process != null && process.isAlive()) {
            log.info("Terminating CLI session {}", sessionId);
            process.destroy();
        }
    }

    List<String> buildCommand(List<String> sessionArgs, SessionOptions options) {
        ApprovalMode mode = options != null && options.getMode() != null ? options.getMode() : defaultMode;
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("-p");
        cmd.add("--permission-mode");
        cmd.add(mode.wireName());
        if (model != null && !model.isBlank()) {
            cmd.add("--model");
            cmd.add(model);
        }
        ApprovalRules rules = options != null ? options.getRules() : null;
        if (rules != null) {
            addToolPatterns(cmd, "--allowedTools", rules.getAllow());
            addToolPatterns(cmd, "--disallowedTools", rules.getDeny());
        }
        cmd.addAll(sessionArgs);
        return cmd;
    }

    private static void addToolPatterns(List<String> cmd, String flag, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return;
        }
        cmd.add(flag);
        for (String pattern : patterns) {
            cmd.add("Bash(" + pattern + ")");
        }
    }

    private Process spawn(List<String> sessionArgs, String message, SessionOptions options) throws IOException {
        Path cwd = options != null && options.getCwd() != null ? Path.of(options.getCwd()) : defaultCwd;
        Process process = launcher.launch(buildCommand(sessionArgs, options), cwd);
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(message.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroy();
            throw e;
        }
        return process;
    }
}
