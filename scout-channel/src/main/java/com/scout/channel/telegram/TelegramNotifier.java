package com.scout.channel.telegram;

import com.scout.scheduler.channel.ApprovalPrompt;
import com.scout.scheduler.channel.ChannelNotifier;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outbound side of the Telegram channel. Conversation keys are chat ids.
 */
@Slf4j
public class TelegramNotifier implements ChannelNotifier {

    static final String APPROVE = "approve";
    static final String DENY = "deny";

    private static final Map<String, Object> APPROVAL_KEYBOARD = Map.of("inline_keyboard", List.of(List.of(
            Map.of("text", "✓ Approve", "callback_data", APPROVE),
            Map.of("text", "✗ Deny", "callback_data", DENY))));

    private final TelegramApi api;

    public TelegramNotifier(TelegramApi api) {
        this.api = api;
    }

    /**
     * Split text into pieces Telegram accepts as one message.
     */
    public static List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < text.length(); i += TelegramApi.MAX_MESSAGE_LENGTH) {
            chunks.add(text.substring(i, Math.min(text.length(), i + TelegramApi.MAX_MESSAGE_LENGTH)));
        }
        return chunks;
    }

    /**
     * @throws UncheckedIOException if any chunk cannot be sent
     */
    @Override
    public void sendReply(String chatId, String text) {
        try {
            for (String part : chunk(text)) {
                api.sendMessage(chatId, part, null);
            }
        } catch (TelegramApiException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void sendIndicator(String chatId) {
        try {
            api.sendChatAction(chatId, "typing");
        } catch (TelegramApiException e) {
            log.debug("Typing indicator for {} failed: {}", chatId, e.getMessage());
        }
    }

    @Override
    public String sendApprovalPrompt(String chatId, ApprovalPrompt prompt) {
        if (!prompt.interactive()) {
            sendReply(chatId, "⏳ Waiting for approval (" + prompt.toolInfo()
                    + ") — answer it in the session's control panel, or /yolo to auto-approve.");
            return null;
        }
        String text = "🔧 " + prompt.toolInfo() + (prompt.detail() != null ? "\n" + prompt.detail() : "");
        try {
            return String.valueOf(api.sendMessage(chatId, text, APPROVAL_KEYBOARD));
        } catch (TelegramApiException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void markApprovalResolved(String chatId, String promptRef, String toolInfo) {
        editMessage(chatId, promptRef, "✓ " + toolInfo + " — approved");
    }

    /**
     * Replace the text of a sent message. Best effort: the message may have
     * been edited or deleted already.
     */
    void editMessage(String chatId, String messageRef, String text) {
        try {
            api.editMessageText(chatId, Long.parseLong(messageRef), text);
        } catch (TelegramApiException | NumberFormatException e) {
            log.debug("Editing message {} in {} failed: {}", messageRef, chatId, e.getMessage());
        }
    }
}
