package com.scout.channel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TelegramApiTest {

    private final FakeBotApi bot = new FakeBotApi();
    private MockWebServer server;
    private TelegramApi api;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(bot);
        server.start();
        api = new TelegramApi("TOKEN", server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void getUpdates_sendsOffsetAndLimit() throws Exception {
        bot.queueUpdates("[{\"update_id\":5},{\"update_id\":6}]");

        List<JsonNode> updates = api.getUpdates(5L, 10);

        assertEquals(2, updates.size());
        assertEquals(6, updates.get(1).path("update_id").asLong());
        String body = bot.calls("getUpdates").get(0).body();
        assertTrue(body.contains("\"offset\":5"));
        assertTrue(body.contains("\"limit\":10"));
        assertTrue(body.contains("\"timeout\":0"));
    }

    @Test
    void sendMessage_returnsMessageId() throws Exception {
        long id = api.sendMessage("42", "hi", Map.of("inline_keyboard", List.of()));

        assertEquals(100, id);
        String body = bot.calls("sendMessage").get(0).body();
        assertTrue(body.contains("\"chat_id\":\"42\""));
        assertTrue(body.contains("\"reply_markup\""));
    }

    @Test
    void notOkReplyThrowsWithDescription() {
        TelegramApiException e = assertThrows(TelegramApiException.class,
                () -> api.downloadFile("missing", Path.of("unused")));
        assertEquals("Telegram: Bad Request: invalid file_id", e.getMessage());
    }

    @Test
    void downloadFile_writesBytes(@TempDir Path dir) throws Exception {
        bot.file("f1", "JPEGDATA".getBytes(StandardCharsets.UTF_8));
        Path dest = dir.resolve("attachments/42/photo.jpg");

        api.downloadFile("f1", dest);

        assertEquals("JPEGDATA", Files.readString(dest));
    }

    @Test
    void unreachableServerIsApiException() {
        TelegramApi offline = new TelegramApi("TOKEN", "http://127.0.0.1:1");
        assertThrows(TelegramApiException.class, () -> offline.sendChatAction("42", "typing"));
    }
}
