package com.scout.scheduler.channel;

/**
 * Outbound primitives a transport gives its orchestrator.
 */
public interface ChannelNotifier {

    void sendReply(String key, String text);

    /** Show that work is in progress ("typing..."). Best effort. */
    void sendIndicator(String key);

    /**
     * Relay an approval request.
     *
     * @return a transport reference to the sent prompt, or null when the
     *         transport cannot edit it later
     */
    String sendApprovalPrompt(String key, ApprovalPrompt prompt);

    /**
     * The request behind a relayed prompt was resolved outside the channel.
     */
    void markApprovalResolved(String key, String promptRef, String toolInfo);
}
