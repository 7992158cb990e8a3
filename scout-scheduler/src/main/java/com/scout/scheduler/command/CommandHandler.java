package com.scout.scheduler.command;

/**
 * Handles one slash command for a conversation key.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * @param args text after the command name, may be empty
     * @param key  conversation key the command was sent from
     */
    CommandResult handle(String args, String key);
}
