package com.scout.scheduler.history;

import com.scout.common.infra.JsonLines;

import java.nio.file.Path;
import java.util.List;

/**
 * Transcript kept in {@code state/<transport>-history.jsonl}.
 */
public class JsonlHistoryRepository implements HistoryRepository {

    private final Path file;

    public JsonlHistoryRepository(Path file) {
        this.file = file;
    }

    @Override
    public void append(ChatMessage message) {
        JsonLines.append(file, message);
    }

    @Override
    public List<ChatMessage> readAll() {
        return JsonLines.readAll(file, ChatMessage.class);
    }
}
