package com.scout.executor.cli;

import com.scout.executor.ApprovalMode;
import com.scout.executor.ExecutorException;
import com.scout.executor.SessionExecutor.ApprovalRules;
import com.scout.executor.SessionExecutor.SessionOptions;
import com.scout.executor.SessionExecutor.SessionStatus;
import com.scout.executor.SessionExecutor.StartResult;
import com.scout.executor.SessionExecutor.StartStatus;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliProcessExecutorTest {

    private final List<List<String>> launched = new ArrayList<>();
    private final List<FakeProcess> processes = new ArrayList<>();

    private CliProcessExecutor executor() {
        return new CliProcessExecutor("claude", Path.of("/tmp"), ApprovalMode.BYPASS, null, (command, cwd) -> {
            launched.add(command);
            FakeProcess process = new FakeProcess();
            processes.add(process);
            return process;
        });
    }

    @Test
    void start_spawnsPrintModeWithFreshSessionIdAndWritesMessage() throws Exception {
        CliProcessExecutor executor = executor();

        StartResult result = executor.start("hello", null);

        assertEquals(StartStatus.STARTED, result.getStatus());
        List<String> cmd = launched.get(0);
        assertEquals(List.of("claude", "-p", "--permission-mode", "bypassPermissions",
                "--session-id", result.getSessionId()), cmd);
        assertEquals("hello", processes.get(0).stdin.toString(StandardCharsets.UTF_8));
        assertTrue(processes.get(0).stdinClosed);
    }

    @Test
    void start_launchFailure_isRejection() {
        CliProcessExecutor executor = new CliProcessExecutor("claude", Path.of("/tmp"), null, null,
                (command, cwd) -> {
                    throw new IOException("no such binary");
                });
        assertThrows(ExecutorException.class, () -> executor.start("hi", null));
    }

    @Test
    void poll_followsProcessLifecycle() throws Exception {
        CliProcessExecutor executor = executor();
        String id = executor.start("hi", null).getSessionId();

        assertEquals(SessionStatus.RUNNING, executor.poll(id).getStatus());
        processes.get(0).exit(0);
        assertEquals(SessionStatus.DONE, executor.poll(id).getStatus());
    }

    @Test
    void poll_nonZeroExitOrUnknownIdIsError() throws Exception {
        CliProcessExecutor executor = executor();
        String id = executor.start("hi", null).getSessionId();
        processes.get(0).exit(3);

        assertEquals(SessionStatus.ERROR, executor.poll(id).getStatus());
        assertEquals("exit code 3", executor.poll(id).getReason());
        assertEquals(SessionStatus.ERROR, executor.poll("missing").getStatus());
    }

    @Test
    void resume_refusedWhilePreviousRunAlive() throws Exception {
        CliProcessExecutor executor = executor();
        String id = executor.start("first", null).getSessionId();

        assertFalse(executor.resume(id, "second", null));
        assertEquals(1, launched.size());

        processes.get(0).exit(0);
        assertTrue(executor.resume(id, "second", null));
        assertEquals(List.of("--resume", id), launched.get(1).subList(launched.get(1).size() - 2, launched.get(1).size()));
    }

    @Test
    void buildCommand_mapsModeModelAndRules() {
        CliProcessExecutor executor = new CliProcessExecutor("claude", Path.of("/tmp"), ApprovalMode.BYPASS,
                "sonnet", (command, cwd) -> new FakeProcess());
        SessionOptions options = SessionOptions.builder()
                .mode(ApprovalMode.ASK)
                .rules(ApprovalRules.builder().deny(List.of("curl *", "sudo *")).build())
                .build();

        List<String> cmd = executor.buildCommand(List.of("--session-id", "x"), options);

        assertEquals(List.of("claude", "-p", "--permission-mode", "default", "--model", "sonnet",
                "--disallowedTools", "Bash(curl *)", "Bash(sudo *)", "--session-id", "x"), cmd);
    }

    @Test
    void cleanup_destroysLiveProcessAndForgetsId() throws Exception {
        CliProcessExecutor executor = executor();
        String id = executor.start("hi", null).getSessionId();

        executor.cleanup(id);

        assertTrue(processes.get(0).destroyed);
        assertEquals(SessionStatus.ERROR, executor.poll(id).getStatus());
    }

    static class FakeProcess extends Process {
        final ByteArrayOutputStream stdin = new ByteArrayOutputStream() {
            @Override
            public void close() throws IOException {
                stdinClosed = true;
                super.close();
            }
        };
        volatile boolean stdinClosed;
        volatile boolean destroyed;
        volatile Integer exitCode;

        void exit(int code) {
            exitCode = code;
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin;
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public int waitFor() {
            return exitCode != null ? exitCode : 0;
        }

        @Override
        public int exitValue() {
            if (exitCode == null) {
                throw new IllegalThreadStateException("running");
            }
            return exitCode;
        }

        @Override
        public boolean isAlive() {
            return exitCode == null;
        }

        @Override
        public void destroy() {
            destroyed = true;
            exitCode = 143;
        }
    }
}
