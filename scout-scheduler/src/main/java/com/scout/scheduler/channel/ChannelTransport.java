package com.scout.scheduler.channel;

/**
 * One messaging transport. Polled on every channel tick; each inbound message
 * is handed to the transport's {@code ChannelOrchestrator}.
 */
public interface ChannelTransport {

    String name();

    /** Whether credentials and at least one allowed user are configured. */
    boolean isEnabled();

    /** Fetch and handle pending inbound events. */
    void poll();
}
