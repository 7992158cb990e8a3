package com.scout.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Root configuration of an assistant instance, read from {@code config.yaml}.
 * <p>
 * Schedules live in the same file but are read by the scheduler module through
 * its own repository, so that their persisted run state can be written back
 * without round-tripping the whole document through this model.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoutConfig {

    /** Instance name (e.g. "my-assistant"). */
    private String name;

    /** Name the assistant uses for itself in conversation history. */
    private String assistantName = "Scout";

    /** IANA zone cron expressions are evaluated in. */
    private String timezone = "Europe/Zurich";

    /** Executor backend selection. */
    private ExecutorSettings executor = new ExecutorSettings();

    /** Per-skill settings (telegram, transcription). */
    private SkillsConfig skills = new SkillsConfig();

    // --- Nested config types ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExecutorSettings {
        /** "remote" (control-plane over HTTP) or "cli" (one process per session). */
        private String kind = "remote";
        /** Control-plane base URL; derived from {@link #port} when unset. */
        private String baseUrl;
        private int port = 3400;
        /** Control-plane project id; derived from the instance directory when unset. */
        private String projectId;
        /** Working directory for CLI sessions; the instance directory when unset. */
        private String cwd;
        /** Agent CLI binary. */
        private String command = "claude";
        private String model;
        /** Default approval mode for sessions that do not specify one. */
        private String permissionMode = "bypassPermissions";
        /** Extra shell patterns denied to scheduled sessions. */
        private List<String> scheduleDeny;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SkillsConfig {
        private TelegramSettings telegram;
        private TranscriptionSettings transcription = new TranscriptionSettings();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TelegramSettings {
        /** Single-user shorthand, superseded by {@link #allowedUsers}. */
        private String chatId;
        private List<AllowedUser> allowedUsers;
        /** Shell command an agent runs to reply; "--to/--message" are appended. */
        private String sendCommand;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AllowedUser {
        private String chatId;
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TranscriptionSettings {
        /** "groq", "openai" or "auto". */
        private String backend = "auto";
        private String groqApiKey;
        private String openaiApiKey;
    }
}
