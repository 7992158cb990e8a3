package com.scout.common.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DotEnvTest {

    @TempDir
    Path tmp;

    @Test
    void parseEnvFile_handlesQuotesCommentsAndExport() throws Exception {
        Path env = tmp.resolve(".env");
        Files.writeString(env, String.join("\n",
                "# comment",
                "PLAIN=value",
                "export EXPORTED=yes",
                "DOUBLE=\"a b\"",
                "SINGLE='c d'",
                "=novalue",
                "garbage",
                ""));

        Map<String, String> vars = DotEnv.parseEnvFile(env);

        assertEquals("value", vars.get("PLAIN"));
        assertEquals("yes", vars.get("EXPORTED"));
        assertEquals("a b", vars.get("DOUBLE"));
        assertEquals("c d", vars.get("SINGLE"));
        assertEquals(4, vars.size());
    }

    @Test
    void get_instanceFileWinsOverProcessEnvironment() throws Exception {
        Path env = tmp.resolve(".env");
        Files.writeString(env, "TELEGRAM_BOT_TOKEN=from-file\nEMPTY=\n");

        DotEnv dotEnv = DotEnv.load(env, Map.of(
                "TELEGRAM_BOT_TOKEN", "from-process",
                "EMPTY", "process-value",
                "ONLY_PROCESS", "p"));

        assertEquals("from-file", dotEnv.get("TELEGRAM_BOT_TOKEN"));
        assertEquals("process-value", dotEnv.get("EMPTY"));
        assertEquals("p", dotEnv.get("ONLY_PROCESS"));
        assertNull(dotEnv.get("MISSING"));
    }

    @Test
    void load_missingFile_usesProcessEnvironmentOnly() {
        DotEnv dotEnv = DotEnv.load(tmp.resolve("nope"), Map.of("K", "v"));
        assertEquals("v", dotEnv.get("K"));
        assertTrue(dotEnv.fileVars().isEmpty());
    }
}
