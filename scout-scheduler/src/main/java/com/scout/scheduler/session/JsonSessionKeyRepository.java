package com.scout.scheduler.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scout.common.infra.JsonFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session table kept in {@code state/<transport>-sessions.json}.
 */
public class JsonSessionKeyRepository implements SessionKeyRepository {

    private static final TypeReference<LinkedHashMap<String, SessionKeyEntry>> TYPE = new TypeReference<>() {
    };

    private final Path file;

    public JsonSessionKeyRepository(Path file) {
        this.file = file;
    }

    @Override
    public Map<String, SessionKeyEntry> load() {
        Map<String, SessionKeyEntry> entries = JsonFile.load(file, TYPE);
        return entries != null ? entries : new LinkedHashMap<>();
    }

    @Override
    public void save(Map<String, SessionKeyEntry> entries) {
        try {
            JsonFile.save(file, entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save sessions to " + file, e);
        }
    }
}
