package com.scout.scheduler.history;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-key conversation history with a bounded recent window.
 */
public class ChatHistory {

    public static final int DEFAULT_CONTEXT_LINES = 20;

    private final HistoryRepository repository;
    private final int contextLines;

    public ChatHistory(HistoryRepository repository) {
        this(repository, DEFAULT_CONTEXT_LINES);
    }

    public ChatHistory(HistoryRepository repository, int contextLines) {
        this.repository = repository;
        this.contextLines = contextLines;
    }

    public void append(ChatMessage message) {
        repository.append(message);
    }

    /**
     * The last messages of {@code key}, oldest first. Filtering happens before
     * truncation so other keys never crowd out this one.
     */
    public List<ChatMessage> loadRecent(String key) {
        List<ChatMessage> mine = repository.readAll().stream()
                .filter(m -> key.equals(m.getKey()))
                .collect(Collectors.toList());
        int from = Math.max(0, mine.size() - contextLines);
        return List.copyOf(mine.subList(from, mine.size()));
    }

    /**
     * Render messages as a prompt block, or an empty string when there are none.
     */
    public static String format(List<ChatMessage> history, String assistantName) {
        if (history.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("## Recent conversation history\n\n");
        for (ChatMessage m : history) {
            String who = ChatMessage.ROLE_USER.equals(m.getRole()) ? m.getName() : assistantName;
            sb.append('[').append(m.getTs()).append("] ")
                    .append(who).append(": ").append(m.getText()).append('\n');
        }
        return sb.toString();
    }
}
