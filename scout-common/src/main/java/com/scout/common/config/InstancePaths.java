package com.scout.common.config;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;

/**
 * Filesystem layout of an assistant instance.
 *
 * <pre>
 *   &lt;instance&gt;/config.yaml
 *   &lt;instance&gt;/.env
 *   &lt;instance&gt;/state/{transport}-sessions.json
 *   &lt;instance&gt;/state/{transport}-history.jsonl
 *   &lt;instance&gt;/state/{transport}-offset.json
 *   &lt;instance&gt;/state/attachments/{chatId}/
 *   &lt;instance&gt;/memory/activity-log.jsonl
 *   &lt;instance&gt;/memory/send-log.jsonl
 * </pre>
 */
public final class InstancePaths {

    public static final String INSTANCE_DIR_ENV = "ASSISTANT_INSTANCE_DIR";
    private static final String DEFAULT_INSTANCE = "assistant-data/assistants/my-assistant";
    private static final String CONFIG_FILENAME = "config.yaml";

    private final Path root;

    public InstancePaths(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Resolve the instance directory: explicit value, then
     * {@code ASSISTANT_INSTANCE_DIR}, then {@code ~/assistant-data/assistants/my-assistant}.
     */
    public static InstancePaths resolve(String explicit) {
        return resolve(explicit, System.getenv(), System.getProperty("user.home"));
    }

    public static InstancePaths resolve(String explicit, Map<String, String> env, String homeDir) {
        String dir = firstNonBlank(explicit, env.get(INSTANCE_DIR_ENV));
        if (dir == null) {
            return new InstancePaths(Path.of(homeDir, DEFAULT_INSTANCE));
        }
        if (dir.startsWith("~")) {
            dir = homeDir + dir.substring(1);
        }
        return new InstancePaths(Path.of(dir));
    }

    public Path root() {
        return root;
    }

    public Path configFile() {
        return root.resolve(CONFIG_FILENAME);
    }

    public Path envFile() {
        return root.resolve(".env");
    }

    public Path stateDir() {
        return root.resolve("state");
    }

    public Path memoryDir() {
        return root.resolve("memory");
    }

    public Path sessionsFile(String transport) {
        return stateDir().resolve(transport + "-sessions.json");
    }

    public Path historyFile(String transport) {
        return stateDir().resolve(transport + "-history.jsonl");
    }

    public Path offsetFile(String transport) {
        return stateDir().resolve(transport + "-offset.json");
    }

    public Path attachmentsDir(String chatId) {
        return stateDir().resolve("attachments").resolve(chatId);
    }

    public Path activityLog() {
        return memoryDir().resolve("activity-log.jsonl");
    }

    public Path sendLog() {
        return memoryDir().resolve("send-log.jsonl");
    }

    /** Control-plane project id: base64url of the instance path, unpadded. */
    public String projectId() {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(root.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
