package com.scout.scheduler.history;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatHistoryTest {

    @TempDir
    Path dir;

    private static ChatMessage user(String key, String text) {
        return ChatMessage.builder().ts("t").role(ChatMessage.ROLE_USER).name("Ana").key(key).text(text).build();
    }

    @Test
    void loadRecent_filtersByKeyBeforeTruncating() {
        ChatHistory history = new ChatHistory(new JsonlHistoryRepository(dir.resolve("h.jsonl")), 3);
        for (int i = 1; i <= 5; i++) {
            history.append(user("a", "a" + i));
            history.append(user("b", "b" + i));
        }
        history.append(user("b", "b6"));
        history.append(user("b", "b7"));

        List<ChatMessage> recent = history.loadRecent("a");
        assertEquals(List.of("a3", "a4", "a5"), recent.stream().map(ChatMessage::getText).toList());
    }

    @Test
    void loadRecent_missingFileIsEmpty() {
        ChatHistory history = new ChatHistory(new JsonlHistoryRepository(dir.resolve("none.jsonl")));
        assertTrue(history.loadRecent("a").isEmpty());
    }

    @Test
    void loadRecent_skipsCorruptLines() throws Exception {
        Path file = dir.resolve("h.jsonl");
        Files.writeString(file, "{\"ts\":\"1\",\"role\":\"user\",\"name\":\"Ana\",\"chatId\":\"a\",\"text\":\"hi\"}\n"
                + "garbage\n"
                + "{\"ts\":\"2\",\"role\":\"assistant\",\"chatId\":\"a\",\"text\":\"hello\"}\n");
        ChatHistory history = new ChatHistory(new JsonlHistoryRepository(file));

        List<ChatMessage> recent = history.loadRecent("a");
        assertEquals(2, recent.size());
        assertEquals("hello", recent.get(1).getText());
    }

    @Test
    void append_writesKeyAsChatId() throws Exception {
        Path file = dir.resolve("h.jsonl");
        new ChatHistory(new JsonlHistoryRepository(file)).append(user("42", "hi"));
        assertTrue(Files.readString(file).contains("\"chatId\":\"42\""));
    }

    @Test
    void format_rendersUsersByNameAndAssistantByConfiguredName() {
        List<ChatMessage> messages = List.of(
                user("a", "what's up?"),
                ChatMessage.builder().ts("t2").role(ChatMessage.ROLE_ASSISTANT).key("a").text("all good").build());

        String block = ChatHistory.format(messages, "Scout");

        assertEquals("## Recent conversation history\n\n[t] Ana: what's up?\n[t2] Scout: all good\n", block);
        assertEquals("", ChatHistory.format(List.of(), "Scout"));
    }
}
