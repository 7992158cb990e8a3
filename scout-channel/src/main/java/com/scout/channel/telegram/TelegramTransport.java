package com.scout.channel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.scout.channel.transcription.TranscriptionService;
import com.scout.common.config.ScoutConfig.AllowedUser;
import com.scout.common.config.ScoutConfig.TelegramSettings;
import com.scout.common.infra.DotEnv;
import com.scout.common.infra.ErrorUtils;
import com.scout.executor.SessionExecutor.InputResponse;
import com.scout.scheduler.channel.ChannelTransport;
import com.scout.scheduler.channel.ChannelUser;
import com.scout.scheduler.command.ChannelCommands;
import com.scout.scheduler.command.CommandResult;
import com.scout.scheduler.orchestrator.ChannelOrchestrator;
import com.scout.scheduler.orchestrator.ChannelOrchestrator.ApprovalResolution;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Inbound side of the Telegram channel: polls {@code getUpdates}, answers
 * approval buttons, runs chat commands, downloads attachments and hands
 * everything else to the orchestrator.
 */
@Slf4j
public class TelegramTransport implements ChannelTransport {

    public static final String NAME = "telegram";
    static final int UPDATE_LIMIT = 10;

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH-mm-ss-SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final TelegramApi api;
    private final TelegramUpdateOffsetStore offsets;
    private final List<ChannelUser> users;
    private final ChannelOrchestrator orchestrator;
    private final ChannelCommands commands;
    private final TelegramNotifier notifier;
    private final TranscriptionService transcription;
    private final Function<String, Path> attachmentsDir;
    private final boolean enabled;
    private Long offset;

    public TelegramTransport(TelegramApi api, TelegramUpdateOffsetStore offsets, List<ChannelUser> users,
            ChannelOrchestrator orchestrator, ChannelCommands commands, TelegramNotifier notifier,
            TranscriptionService transcription, Function<String, Path> attachmentsDir, boolean hasToken) {
        this.api = api;
        this.offsets = offsets;
        this.users = List.copyOf(users);
        this.orchestrator = orchestrator;
        this.commands = commands;
        this.notifier = notifier;
        this.transcription = transcription;
        this.attachmentsDir = attachmentsDir;
        this.enabled = hasToken && !this.users.isEmpty();
        this.offset = offsets.read();
    }

    /**
     * Users allowed to talk to the assistant: {@code allowedUsers}, else a
     * single {@code chatId} from config or {@code TELEGRAM_CHAT_ID}.
     */
    public static List<ChannelUser> resolveUsers(TelegramSettings settings, DotEnv env) {
        if (settings == null) {
            return List.of();
        }
        if (settings.getAllowedUsers() != null) {
            List<ChannelUser> users = new ArrayList<>();
            for (AllowedUser u : settings.getAllowedUsers()) {
                if (u.getChatId() != null) {
                    users.add(new ChannelUser(u.getChatId(), u.getName() != null ? u.getName() : "User"));
                }
            }
            return users;
        }
        String chatId = settings.getChatId() != null ? settings.getChatId() : env.get("TELEGRAM_CHAT_ID");
        return chatId != null ? List.of(new ChannelUser(chatId, "User")) : List.of();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void poll() {
        List<JsonNode> updates;
        try {
            updates = api.getUpdates(offset, UPDATE_LIMIT);
        } catch (TelegramApiException e) {
            log.warn("Telegram poll error: {}", e.getMessage());
            return;
        }
        for (JsonNode update : updates) {
            offset = update.path("update_id").asLong() + 1;
            offsets.write(offset);
            try {
                if (update.has("callback_query")) {
                    handleCallback(update.path("callback_query"));
                } else if (update.has("message")) {
                    handleMessage(update.path("message"));
                }
            } catch (RuntimeException e) {
                log.error("Telegram update {} failed: {}", update.path("update_id").asLong(),
                        ErrorUtils.formatErrorMessage(e), e);
            }
        }
    }

    private ChannelUser findUser(String chatId) {
        return users.stream().filter(u -> u.chatId().equals(chatId)).findFirst().orElse(null);
    }

    void handleCallback(JsonNode callback) {
        JsonNode message = callback.path("message");
        String chatId = message.path("chat").has("id") ? message.path("chat").path("id").asText() : null;
        InputResponse decision = switch (callback.path("data").asText("")) {
            case TelegramNotifier.APPROVE -> InputResponse.APPROVE;
            case TelegramNotifier.DENY -> InputResponse.DENY;
            default -> null;
        };
        try {
            if (chatId != null && decision != null && findUser(chatId) != null) {
                String messageId = message.path("message_id").asText();
                ApprovalResolution resolution = orchestrator.respondToApproval(chatId, messageId, decision);
                notifier.editMessage(chatId, messageId, resolution.text());
            }
        } finally {
            try {
                api.answerCallbackQuery(callback.path("id").asText());
            } catch (TelegramApiException e) {
                log.debug("answerCallbackQuery failed: {}", e.getMessage());
            }
        }
    }

    void handleMessage(JsonNode msg) {
        String text = msg.path("text").asText(msg.path("caption").asText(""));
        JsonNode photos = msg.path("photo");
        boolean hasPhoto = photos.isArray() && photos.size() > 0;
        boolean hasDocument = msg.has("document");
        boolean hasVoice = msg.has("voice");
        boolean hasAudio = msg.has("audio");
        if (text.isEmpty() && !hasPhoto && !hasDocument && !hasVoice && !hasAudio) {
            return;
        }

        String chatId = msg.path("chat").path("id").asText();
        ChannelUser user = findUser(chatId);
        if (user == null) {
            log.info("Telegram: ignoring message from unauthorized chat {}", chatId);
            return;
        }

        CommandResult command = commands.handleCommand(text, chatId);
        if (command != null) {
            if (command.hasReply()) {
                notifier.sendReply(chatId, command.text());
            }
            return;
        }

        String attachmentNote = hasPhoto ? " [photo attached]"
                : hasDocument ? " [file: " + msg.path("document").path("file_name").asText("document") + "]"
                : hasVoice || hasAudio ? " [audio message]"
                : "";
        log.info("Telegram: message from {} (@{}): {}{}", user.name(),
                msg.path("from").path("username").asText("unknown"),
                ErrorUtils.preview(text.isEmpty() ? "(no text)" : text, 80), attachmentNote);

        String ts = FILE_TS.format(Instant.ofEpochSecond(msg.path("date").asLong()));
        Path dir = attachmentsDir.apply(chatId);
        List<String> attachments = new ArrayList<>();

        if (hasPhoto) {
            JsonNode largest = photos.get(photos.size() - 1);
            download(largest.path("file_id").asText(), dir.resolve(ts + "-photo.jpg"), attachments);
        }
        if (hasDocument) {
            JsonNode doc = msg.path("document");
            String fileName = doc.path("file_name").asText("document.bin");
            String safeName = Path.of(fileName).getFileName().toString();
            download(doc.path("file_id").asText(), dir.resolve(ts + "-" + safeName), attachments);
        }
        if (hasVoice || hasAudio) {
            text = withTranscript(msg, hasVoice, text, dir.resolve(ts + "-voice." + audioExtension(msg, hasVoice)));
        }

        orchestrator.dispatch(user, text + attachmentNote, attachments);
    }

    private void download(String fileId, Path dest, List<String> attachments) {
        try {
            api.downloadFile(fileId, dest);
            attachments.add(dest.toString());
            log.info("  Downloaded {}", dest);
        } catch (IOException e) {
            log.warn("  Failed to download {}: {}", dest.getFileName(), e.getMessage());
        }
    }

    private String withTranscript(JsonNode msg, boolean hasVoice, String text, Path dest) {
        String fileId = hasVoice ? msg.path("voice").path("file_id").asText() : msg.path("audio").path("file_id").asText();
        try {
            api.downloadFile(fileId, dest);
        } catch (IOException e) {
            log.warn("  Failed to process voice: {}", e.getMessage());
            return text.isEmpty() ? "[voice message — transcription failed]" : text;
        }
        String transcript = transcription.transcribe(dest);
        log.info("  Transcription: {}", ErrorUtils.preview(transcript, 100));
        String prefix = "[voice message: \"" + transcript + "\"]";
        return text.isEmpty() ? prefix : prefix + " " + text;
    }

    private static String audioExtension(JsonNode msg, boolean hasVoice) {
        if (hasVoice) {
            return "ogg";
        }
        String fileName = msg.path("audio").path("file_name").asText("");
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : "ogg";
    }
}
