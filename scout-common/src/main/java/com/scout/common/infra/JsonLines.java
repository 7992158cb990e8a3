package com.scout.common.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only JSONL files: one JSON object per line.
 * <p>
 * Appends to the same file are serialized inside this process; the files are
 * never shared between processes.
 */
@Slf4j
public final class JsonLines {

    private JsonLines() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final Map<Path, Object> LOCKS = new ConcurrentHashMap<>();

    /**
     * Append one entry as a single line, creating parent directories as needed.
     *
     * @throws UncheckedIOException if the line cannot be written
     */
    public static void append(Path path, Object entry) {
        Path key = path.toAbsolutePath().normalize();
        synchronized (LOCKS.computeIfAbsent(key, k -> new Object())) {
            try {
                Files.createDirectories(key.getParent());
                String line = MAPPER.writeValueAsString(entry) + "\n";
                Files.writeString(key, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to " + path, e);
            }
        }
    }

    /**
     * Read every parseable line. Malformed lines are skipped; a missing file
     * reads as empty.
     */
    public static <T> List<T> readAll(Path path, Class<T> type) {
        List<T> entries = new ArrayList<>();
        if (!Files.exists(path)) {
            return entries;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    entries.add(MAPPER.readValue(line, type));
                } catch (IOException e) {
                    log.debug("Skipping malformed line {} in {}: {}", lineNo, path, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
        }
        return entries;
    }
}
