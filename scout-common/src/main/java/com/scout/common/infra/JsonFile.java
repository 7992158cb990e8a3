package com.scout.common.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON document load/save with owner-only permissions and atomic replace.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Load and parse a JSON file. Returns null if the file does not exist or is
     * invalid.
     */
    public static <T> T load(Path path, Class<T> type) {
        try {
            if (!Files.exists(path))
                return null;
            return MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON file {}: {}", path, e.getMessage());
            return null;
        }
    }

    public static <T> T load(Path path, TypeReference<T> type) {
        try {
            if (!Files.exists(path))
                return null;
            return MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.warn("Ignoring unreadable JSON file {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Save data as a JSON file with restrictive permissions (owner-only rw).
     */
    public static void save(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(path.getFileName() + ".tmp");
        Files.writeString(tmp, MAPPER.writeValueAsString(data) + "\n");

        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(tmp, perms);
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX (e.g. Windows), skip
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
