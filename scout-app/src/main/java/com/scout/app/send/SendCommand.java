package com.scout.app.send;

import com.scout.channel.telegram.TelegramApi;
import com.scout.channel.telegram.TelegramApiException;
import com.scout.channel.telegram.TelegramNotifier;
import com.scout.channel.telegram.TelegramTransport;
import com.scout.common.config.InstancePaths;
import com.scout.common.infra.DotEnv;
import com.scout.common.infra.JsonLines;
import com.scout.scheduler.history.ChatMessage;
import com.scout.scheduler.history.JsonlHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * The reply primitive agents invoke: {@code send --transport=telegram|log
 * [--to=<id>] (--message=<text> | --message-file=<path>)}.
 * <p>
 * Telegram sends are appended to the transport's history log so the next
 * fresh session sees what the assistant said.
 */
@Slf4j
public class SendCommand {

    public static final String TRANSPORT_LOG = "log";

    /** Parsed command line; {@code messageFile} wins over {@code message}. */
    public record Request(String transport, String to, String message, String messageFile) {

        public static Request from(ApplicationArguments args) {
            return new Request(option(args, "transport"), option(args, "to"), option(args, "message"),
                    option(args, "message-file"));
        }

        private static String option(ApplicationArguments args, String name) {
            List<String> values = args.getOptionValues(name);
            return values == null || values.isEmpty() ? null : values.get(0);
        }
    }

    public record SendLogEntry(String ts, String message) {
    }

    private final InstancePaths paths;
    private final DotEnv env;
    private final String assistantName;
    private final Clock clock;
    private final String telegramApiBase;

    public SendCommand(InstancePaths paths, DotEnv env, String assistantName, Clock clock, String telegramApiBase) {
        this.paths = paths;
        this.env = env;
        this.assistantName = assistantName;
        this.clock = clock;
        this.telegramApiBase = telegramApiBase;
    }

    /**
     * @return process exit code
     */
    public int run(Request request) {
        String text = request.message();
        if (request.messageFile() != null) {
            Path file = Path.of(request.messageFile()).toAbsolutePath();
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.error("Cannot read {}: {}", file, e.getMessage());
                return 1;
            }
        }
        if (text == null || text.isEmpty()) {
            log.error("No message. Use --message or --message-file.");
            return 1;
        }

        String transport = request.transport() != null ? request.transport() : TRANSPORT_LOG;
        return switch (transport) {
            case TelegramTransport.NAME -> sendTelegram(request.to(), text);
            case TRANSPORT_LOG -> sendLog(text);
            default -> {
                log.error("Unknown transport: {} (available: telegram, log)", transport);
                yield 1;
            }
        };
    }

    private int sendTelegram(String to, String text) {
        String token = env.get("TELEGRAM_BOT_TOKEN");
        if (token == null) {
            log.error("TELEGRAM_BOT_TOKEN not set.");
            return 1;
        }
        String chatId = to != null && !to.isBlank() ? to : env.get("TELEGRAM_CHAT_ID");
        if (chatId == null) {
            log.error("No recipient. Use --to or set TELEGRAM_CHAT_ID.");
            return 1;
        }

        TelegramApi api = new TelegramApi(token, telegramApiBase);
        try {
            for (String part : TelegramNotifier.chunk(text)) {
                api.sendMessage(chatId, part, null);
            }
        } catch (TelegramApiException e) {
            log.error("Telegram error: {}", e.getMessage());
            return 1;
        }

        new JsonlHistoryRepository(paths.historyFile(TelegramTransport.NAME)).append(ChatMessage.builder()
                .ts(clock.instant().toString())
                .role(ChatMessage.ROLE_ASSISTANT)
                .name(assistantName)
                .key(chatId)
                .text(text)
                .build());
        log.info("Sent via Telegram to {}.", chatId);
        return 0;
    }

    private int sendLog(String text) {
        JsonLines.append(paths.sendLog(), new SendLogEntry(clock.instant().toString(), text));
        log.info("Logged to memory/send-log.jsonl");
        return 0;
    }
}
