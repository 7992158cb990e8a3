package com.scout.channel.telegram;

import java.io.IOException;

/**
 * A Bot API call failed: transport error, non-JSON reply, or {@code ok: false}.
 */
public class TelegramApiException extends IOException {

    public TelegramApiException(String message) {
        super(message);
    }

    public TelegramApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
