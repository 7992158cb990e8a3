package com.scout.common.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tmp;

    @Test
    void loadConfig_parsesNestedSettingsAndKeepsDefaults() throws Exception {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, String.join("\n",
                "name: home",
                "executor:",
                "  kind: cli",
                "  model: sonnet",
                "skills:",
                "  telegram:",
                "    allowedUsers:",
                "      - chatId: '42'",
                "        name: Ada",
                "unknownTopLevel: ignored",
                ""));

        ScoutConfig config = new ConfigService(file).loadConfig();

        assertEquals("home", config.getName());
        assertEquals("Europe/Zurich", config.getTimezone());
        assertEquals("cli", config.getExecutor().getKind());
        assertEquals("sonnet", config.getExecutor().getModel());
        assertEquals(3400, config.getExecutor().getPort());
        assertEquals("42", config.getSkills().getTelegram().getAllowedUsers().get(0).getChatId());
        assertEquals("auto", config.getSkills().getTranscription().getBackend());
    }

    @Test
    void loadConfig_missingFile_throwsConfigException() {
        ConfigService service = new ConfigService(tmp.resolve("absent.yaml"));
        assertThrows(ConfigException.class, service::loadConfig);
    }

    @Test
    void loadConfig_malformedYaml_throwsConfigException() throws Exception {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, "name: [unterminated\n");
        assertThrows(ConfigException.class, () -> new ConfigService(file).loadConfig());
    }

    @Test
    void reloadConfig_seesEditsInsideCacheWindow() throws Exception {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, "name: first\n");
        ConfigService service = new ConfigService(file, Duration.ofHours(1));

        assertEquals("first", service.loadConfig().getName());
        Files.writeString(file, "name: second\n");
        assertEquals("first", service.loadConfig().getName());
        assertEquals("second", service.reloadConfig().getName());
    }

    @Test
    void saveTree_preservesUnknownKeysAndInvalidatesCache() throws Exception {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, "name: first\ncustom:\n  keep: true\n");
        ConfigService service = new ConfigService(file, Duration.ofHours(1));
        service.loadConfig();

        ObjectNode tree = service.loadTree();
        tree.put("name", "renamed");
        service.saveTree(tree);

        assertEquals("renamed", service.loadConfig().getName());
        assertTrue(service.loadTree().path("custom").path("keep").asBoolean());
        assertFalse(Files.exists(tmp.resolve("config.yaml.tmp")));
    }
}
