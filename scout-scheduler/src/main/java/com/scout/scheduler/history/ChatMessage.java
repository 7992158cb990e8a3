package com.scout.scheduler.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a conversation transcript.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    /** ISO-8601 instant. */
    private String ts;
    /** {@link #ROLE_USER} or {@link #ROLE_ASSISTANT}. */
    private String role;
    /** Display name of the sender. */
    private String name;
    /** Conversation key; written as {@code chatId}. */
    @JsonProperty("chatId")
    private String key;
    private String text;
}
