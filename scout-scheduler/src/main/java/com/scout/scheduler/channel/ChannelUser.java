package com.scout.scheduler.channel;

/**
 * An allowed sender. The chat id doubles as the conversation key.
 */
public record ChannelUser(String chatId, String name) {
}
