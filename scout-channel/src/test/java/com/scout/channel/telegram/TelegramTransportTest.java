package com.scout.channel.telegram;

import com.scout.channel.transcription.Transcriber;
import com.scout.channel.transcription.TranscriptionService;
import com.scout.common.config.ScoutConfig.AllowedUser;
import com.scout.common.config.ScoutConfig.TelegramSettings;
import com.scout.common.infra.DotEnv;
import com.scout.executor.ApprovalMode;
import com.scout.executor.SessionExecutor;
import com.scout.scheduler.activity.ActivityRecorder;
import com.scout.scheduler.channel.ChannelUser;
import com.scout.scheduler.command.ChannelCommands;
import com.scout.scheduler.history.ChatHistory;
import com.scout.scheduler.history.JsonlHistoryRepository;
import com.scout.scheduler.orchestrator.ChannelOrchestrator;
import com.scout.scheduler.session.JsonSessionKeyRepository;
import com.scout.scheduler.session.SessionKeyStore;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TelegramTransportTest {

    /** Records what the transport asks of the backend. */
    static class StubExecutor implements SessionExecutor {
        final List<String> starts = new ArrayList<>();
        final List<String> answers = new ArrayList<>();
        PollResult nextPoll = PollResult.running();

        @Override
        public String name() {
            return "stub";
        }

        @Override
        public StartResult start(String message, SessionOptions options) {
            starts.add(message);
            return new StartResult("s" + starts.size(), StartStatus.STARTED);
        }

        @Override
        public boolean resume(String sessionId, String message, SessionOptions options) {
            return false;
        }

        @Override
        public PollResult poll(String sessionId) {
            return nextPoll;
        }

        @Override
        public void cleanup(String sessionId) {
        }

        @Override
        public boolean supportsInputResponse() {
            return true;
        }

        @Override
        public boolean respondToInput(String sessionId, String requestId, InputResponse response, String feedback) {
            answers.add(sessionId + ":" + requestId + ":" + response.wireName());
            return true;
        }
    }

    static class FixedTranscriber implements Transcriber {
        @Override
        public String name() {
            return "fixed";
        }

        @Override
        public String transcribe(Path audioFile) {
            return "hello there";
        }
    }

    @TempDir
    Path dir;

    private final FakeBotApi bot = new FakeBotApi();
    private final StubExecutor executor = new StubExecutor();
    private MockWebServer server;
    private ChannelOrchestrator orchestrator;
    private TelegramTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(bot);
        server.start();
        transport = newTransport();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private TelegramTransport newTransport() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T09:00:00Z"), ZoneOffset.UTC);
        TelegramApi api = new TelegramApi("TOKEN", server.url("/").toString());
        TelegramNotifier notifier = new TelegramNotifier(api);
        orchestrator = new ChannelOrchestrator(
                new ChannelOrchestrator.Settings("telegram", "scout send --transport=telegram", "Scout", null,
                        Duration.ofSeconds(60)),
                executor,
                new SessionKeyStore(new JsonSessionKeyRepository(dir.resolve("state/telegram-sessions.json")), clock),
                new ChatHistory(new JsonlHistoryRepository(dir.resolve("state/telegram-history.jsonl"))),
                ActivityRecorder.jsonl(dir.resolve("memory/activity-log.jsonl"), clock),
                notifier,
                clock);
        return new TelegramTransport(api,
                new TelegramUpdateOffsetStore(dir.resolve("state/telegram-offset.json")),
                List.of(new ChannelUser("42", "Ada")),
                orchestrator,
                new ChannelCommands(orchestrator, ApprovalMode.BYPASS),
                notifier,
                new TranscriptionService("auto", List.of(new FixedTranscriber())),
                chatId -> dir.resolve("state/attachments").resolve(chatId),
                true);
    }

    private static String message(long updateId, String chatId, String fields) {
        return "{\"update_id\":" + updateId + ",\"message\":{\"message_id\":7,\"date\":1767225600,"
                + "\"chat\":{\"id\":" + chatId + "},\"from\":{\"username\":\"ada\"}" + fields + "}}";
    }

    @Test
    void textMessageStartsSession() {
        bot.queueUpdates("[" + message(1, "42", ",\"text\":\"what's on today?\"") + "]");

        transport.poll();

        assertEquals(1, executor.starts.size());
        assertTrue(executor.starts.get(0).contains("Ada:\nwhat's on today?"));
        assertFalse(bot.calls("sendChatAction").isEmpty());
        assertTrue(orchestrator.isActive("42"));
    }

    @Test
    void unauthorizedChatIsIgnoredButConsumed() throws IOException {
        bot.queueUpdates("[" + message(5, "99", ",\"text\":\"hi\"") + "]");

        transport.poll();

        assertTrue(executor.starts.isEmpty());
        assertTrue(bot.calls("sendMessage").isEmpty());
        assertTrue(Files.readString(dir.resolve("state/telegram-offset.json")).contains("6"));
    }

    @Test
    void offsetSurvivesRestart() {
        bot.queueUpdates("[" + message(5, "99", ",\"text\":\"hi\"") + "]");
        transport.poll();

        newTransport().poll();

        List<FakeBotApi.Call> polls = bot.calls("getUpdates");
        assertFalse(polls.get(0).body().contains("offset"));
        assertTrue(polls.get(1).body().contains("\"offset\":6"));
    }

    @Test
    void photoIsDownloadedAndListed() throws IOException {
        bot.file("small", "S".getBytes(StandardCharsets.UTF_8));
        bot.file("big", "BIG".getBytes(StandardCharsets.UTF_8));
        bot.queueUpdates("[" + message(1, "42", ",\"caption\":\"look\",\"photo\":"
                + "[{\"file_id\":\"small\"},{\"file_id\":\"big\"}]") + "]");

        transport.poll();

        Path saved = dir.resolve("state/attachments/42/2026-01-01T00-00-00-000Z-photo.jpg");
        assertEquals("BIG", Files.readString(saved));
        String payload = executor.starts.get(0);
        assertTrue(payload.contains("- " + saved));
        assertTrue(payload.contains("look [photo attached]"));
    }

    @Test
    void documentNameIsKeptWithoutDirectories() {
        bot.file("doc", "PDF".getBytes(StandardCharsets.UTF_8));
        bot.queueUpdates("[" + message(1, "42",
                ",\"document\":{\"file_id\":\"doc\",\"file_name\":\"../../report.pdf\"}") + "]");

        transport.poll();

        assertTrue(Files.exists(dir.resolve("state/attachments/42/2026-01-01T00-00-00-000Z-report.pdf")));
        assertTrue(executor.starts.get(0).contains("[file: ../../report.pdf]"));
    }

    @Test
    void voiceIsTranscribed() {
        bot.file("v1", "OGG".getBytes(StandardCharsets.UTF_8));
        bot.queueUpdates("[" + message(1, "42", ",\"voice\":{\"file_id\":\"v1\"}") + "]");

        transport.poll();

        assertTrue(executor.starts.get(0).contains("[voice message: \"hello there\"] [audio message]"));
        assertTrue(Files.exists(dir.resolve("state/attachments/42/2026-01-01T00-00-00-000Z-voice.ogg")));
    }

    @Test
    void commandsAreAnsweredInChat() {
        bot.queueUpdates("[" + message(1, "42", ",\"text\":\"/status\"") + "]");

        transport.poll();

        assertTrue(executor.starts.isEmpty());
        String reply = bot.calls("sendMessage").get(0).body();
        assertTrue(reply.contains("No active session."));
    }

    @Nested
    class ApprovalButtons {

        @BeforeEach
        void relayPrompt() {
            bot.queueUpdates("[" + message(1, "42", ",\"text\":\"clean the build\"") + "]");
            transport.poll();
            executor.nextPoll = SessionExecutor.PollResult.builder()
                    .status(SessionExecutor.SessionStatus.RUNNING)
                    .pendingInput(SessionExecutor.PendingInput.builder()
                            .type("tool-approval").toolName("Bash").requestId("r1").prompt("rm -rf build").build())
                    .build();
            orchestrator.refresh();
        }

        private String callback(String data) {
            return callback(data, 100);
        }

        private String callback(String data, int messageId) {
            return "[{\"update_id\":2,\"callback_query\":{\"id\":\"cb1\",\"data\":\"" + data + "\","
                    + "\"message\":{\"message_id\":" + messageId + ",\"chat\":{\"id\":42}}}}]";
        }

        @Test
        void approveAnswersSessionAndEditsPrompt() {
            assertTrue(bot.calls("sendMessage").get(0).body().contains("\"callback_data\":\"approve\""));
            bot.queueUpdates(callback("approve"));

            transport.poll();

            assertEquals(List.of("s1:r1:approve"), executor.answers);
            assertTrue(bot.calls("editMessageText").get(0).body().contains("✓ Approved: Bash"));
            assertEquals(1, bot.calls("answerCallbackQuery").size());
        }

        @Test
        void secondPressIsStale() {
            bot.queueUpdates(callback("deny"));
            transport.poll();
            bot.queueUpdates(callback("approve"));
            transport.poll();

            assertEquals(List.of("s1:r1:deny"), executor.answers);
            assertTrue(bot.calls("editMessageText").get(1).body().contains("Already handled"));
            assertEquals(2, bot.calls("answerCallbackQuery").size());
        }

        @Test
        void pressOnOtherPromptIsStale() {
            bot.queueUpdates(callback("approve", 99));

            transport.poll();

            assertTrue(executor.answers.isEmpty());
            String edit = bot.calls("editMessageText").get(0).body();
            assertTrue(edit.contains("\"message_id\":99"));
            assertTrue(edit.contains("Already handled"));
            assertEquals(1, bot.calls("answerCallbackQuery").size());
        }
    }

    @Nested
    class ResolveUsers {

        private final DotEnv env = DotEnv.load(Path.of("missing.env"), Map.of("TELEGRAM_CHAT_ID", "7"));

        @Test
        void allowedUsersWin() {
            TelegramSettings s = new TelegramSettings();
            s.setChatId("1");
            s.setAllowedUsers(List.of(new AllowedUser("2", "Bob"), new AllowedUser("3", null)));

            assertEquals(List.of(new ChannelUser("2", "Bob"), new ChannelUser("3", "User")),
                    TelegramTransport.resolveUsers(s, env));
        }

        @Test
        void fallsBackToEnvironmentChatId() {
            assertEquals(List.of(new ChannelUser("7", "User")),
                    TelegramTransport.resolveUsers(new TelegramSettings(), env));
        }

        @Test
        void noSettingsMeansNoUsers() {
            assertEquals(List.of(), TelegramTransport.resolveUsers(null, env));
        }
    }
}
