package com.scout.scheduler.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.scheduler.channel.ChannelUser;
import com.scout.scheduler.history.ChatHistory;
import com.scout.scheduler.history.ChatMessage;
import com.scout.scheduler.schedule.ScheduleDefinition;
import com.scout.scheduler.schedule.SkillStep;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the first message of a session.
 */
public final class TaskPayloads {

    private TaskPayloads() {
    }

    private static final ObjectMapper JSON = new ObjectMapper();

    static final String AUTONOMY_FOOTER =
            "Execute autonomously. Do not ask questions. Do not produce unnecessary output.";

    /**
     * Payload for a cron fire: trigger marker, the ordered skills, the
     * delivery target and closing instructions.
     */
    public static String schedule(ScheduleDefinition def) {
        StringBuilder sb = new StringBuilder();
        sb.append("ASSISTANT_TRIGGER=cron:").append(def.getName()).append("\n\n");
        sb.append("Run the \"").append(def.getName()).append("\" schedule. Execute these skills in order:\n");
        List<SkillStep> steps = def.getSkills() != null ? def.getSkills() : List.of();
        for (SkillStep step : steps) {
            sb.append("- ").append(step.getSkill());
            if (step.getArgs() != null && !step.getArgs().isEmpty()) {
                sb.append(" (args: ").append(toJson(step.getArgs())).append(')');
            }
            sb.append('\n');
        }
        if (def.getOutput() != null && !def.getOutput().isBlank()) {
            sb.append("\nDeliver the combined output via the ").append(def.getOutput()).append(" skill.\n");
        }
        sb.append('\n');
        sb.append(def.getPrompt() != null ? def.getPrompt() : "When done, summarize what you did.");
        sb.append("\n\n").append(AUTONOMY_FOOTER);
        return sb.toString();
    }

    /**
     * Payload for a fresh channel session.
     *
     * @param sendCommand command prefix the agent runs to reply; {@code --to}
     *                    and {@code --message} are appended
     */
    public static String channel(String transport, ChannelUser user, String sendCommand, String assistantName,
            List<ChatMessage> history, List<String> attachments, String text) {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("transport", transport);
        meta.put("chatId", user.chatId());
        meta.put("userName", user.name());
        meta.put("sendCommand", sendCommand);

        String replyTo = sendCommand + " --to=" + user.chatId();
        StringBuilder sb = new StringBuilder();
        sb.append("ASSISTANT_TRIGGER=channel:").append(transport).append('\n');
        sb.append("ASSISTANT_CHANNEL=").append(toJson(meta)).append("\n\n");
        sb.append("## Channel mode behavior\n\n");
        sb.append("You are responding to a message from a ").append(transport)
                .append(" chat. Follow these rules:\n");
        sb.append("1. Work silently. Tool calls, research and browsing are invisible to the user.\n");
        sb.append("2. Send a final concise response through the reply command when done.\n");
        sb.append("3. Limit to 1-3 messages. Batch information into a single message when possible.\n");
        sb.append("4. Keep messages short, under ~500 chars unless detail was requested.\n");
        sb.append("5. Match conversational tone. This is chat, not a terminal.\n");
        sb.append("6. For long content, write it to a file and send it with --message-file=<path>.\n");
        sb.append("7. If a task takes significant work, send a brief acknowledgment first, then the result.\n\n");

        String historyBlock = ChatHistory.format(history, assistantName);
        if (!historyBlock.isEmpty()) {
            sb.append(historyBlock).append('\n');
        }
        if (attachments != null && !attachments.isEmpty()) {
            sb.append("## Attachments\n\n");
            sb.append("The user sent the following files. Use the Read tool to view them:\n");
            for (String a : attachments) {
                sb.append("- ").append(a).append('\n');
            }
            sb.append('\n');
        }
        sb.append("## New message\n\n");
        sb.append(user.name()).append(":\n").append(text).append("\n\n");
        sb.append("To reply: ").append(replyTo).append(" --message=\"your response\"\n");
        sb.append("For long content: write it to /tmp/reply.md, then: ")
                .append(replyTo).append(" --message-file=/tmp/reply.md\n\n");
        sb.append("Execute autonomously. Send your response through the reply command, then finish.");
        return sb.toString();
    }

    /**
     * Payload for a resumed session: the message alone, since the session
     * already holds the conversation.
     */
    public static String resume(String text, List<String> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text).append("\n\nAttachments:");
        for (String a : attachments) {
            sb.append("\n- ").append(a);
        }
        return sb.toString();
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable payload value", e);
        }
    }
}
