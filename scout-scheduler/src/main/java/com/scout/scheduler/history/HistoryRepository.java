package com.scout.scheduler.history;

import java.util.List;

/**
 * Append-only transcript storage shared by every key of one transport.
 */
public interface HistoryRepository {

    void append(ChatMessage message);

    /** Every stored message, oldest first. */
    List<ChatMessage> readAll();
}
