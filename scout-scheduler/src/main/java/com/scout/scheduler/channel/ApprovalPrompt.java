package com.scout.scheduler.channel;

/**
 * Outbound request for a human decision.
 *
 * @param toolInfo    what the session wants to use
 * @param detail      what it wants to do with it, may be null
 * @param interactive whether the answer can be sent back to the session;
 *                    otherwise the prompt is informational only
 */
public record ApprovalPrompt(String toolInfo, String detail, boolean interactive) {
}
