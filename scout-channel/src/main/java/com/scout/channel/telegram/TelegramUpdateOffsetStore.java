package com.scout.channel.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scout.common.infra.JsonFile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Next {@code getUpdates} offset, persisted so a restart neither replays nor
 * skips updates.
 */
@Slf4j
public class TelegramUpdateOffsetStore {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OffsetFile {
        private Long offset;
    }

    private final Path file;

    public TelegramUpdateOffsetStore(Path file) {
        this.file = file;
    }

    /**
     * @return the stored offset, or null when none was stored or the file is unreadable
     */
    public Long read() {
        OffsetFile stored = JsonFile.load(file, OffsetFile.class);
        return stored != null ? stored.getOffset() : null;
    }

    public void write(long offset) {
        try {
            JsonFile.save(file, new OffsetFile(offset));
        } catch (IOException e) {
            // a lost offset means updates are replayed once after restart
            log.warn("Failed to save Telegram offset to {}: {}", file, e.getMessage());
        }
    }
}
