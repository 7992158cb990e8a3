package com.scout.scheduler.command;

/**
 * Result of a channel command.
 *
 * @param text reply to send, or null when the command is consumed silently
 */
public record CommandResult(String text) {

    public static CommandResult text(String text) {
        return new CommandResult(text);
    }

    /** Command handled, nothing to say. */
    public static CommandResult silent() {
        return new CommandResult(null);
    }

    public boolean hasReply() {
        return text != null && !text.isEmpty();
    }
}
