package com.scout.scheduler.command;

import com.scout.executor.ApprovalMode;
import com.scout.executor.SessionExecutor.PollResult;
import com.scout.scheduler.orchestrator.ChannelOrchestrator;
import com.scout.scheduler.orchestrator.ChannelOrchestrator.StatusSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Slash commands available in every chat channel.
 * <p>
 * Routes {@code /name args} to the registered handler. Text that is not a
 * command, or names an unknown command, is left for normal dispatch.
 */
@Slf4j
public class ChannelCommands {

    private record Command(String description, CommandHandler handler) {
    }

    private static final Map<ApprovalMode, String> MODE_LABELS = Map.of(
            ApprovalMode.BYPASS, "yolo (auto-approve everything)",
            ApprovalMode.ASK, "careful (approve writes, auto-approve reads)",
            ApprovalMode.PLAN, "readonly (read-only, no mutations)");

    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final ChannelOrchestrator orchestrator;
    private final ApprovalMode defaultMode;

    public ChannelCommands(ChannelOrchestrator orchestrator, ApprovalMode defaultMode) {
        this.orchestrator = orchestrator;
        this.defaultMode = defaultMode != null ? defaultMode : ApprovalMode.BYPASS;

        commands.put("new", new Command("Reset session — start fresh", this::handleNew));
        commands.put("stop", new Command("Abort current session", this::handleStop));
        commands.put("yolo", new Command("Auto-approve everything (default)",
                (args, key) -> setMode(key, ApprovalMode.BYPASS, "Mode: yolo — auto-approve everything.")));
        commands.put("careful", new Command("Auto-approve reads, prompt for writes",
                (args, key) -> setMode(key, ApprovalMode.ASK,
                        "Mode: careful — reads auto-approved, writes need approval.")));
        commands.put("readonly", new Command("Read-only — no mutations allowed",
                (args, key) -> setMode(key, ApprovalMode.PLAN, "Mode: readonly — no mutations.")));
        commands.put("status", new Command("Show current session info", this::handleStatus));
        commands.put("help", new Command("List available commands", this::handleHelp));
    }

    /**
     * Handle a slash command.
     *
     * @return the result, or null when the text is not a known command
     */
    public CommandResult handleCommand(String text, String key) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("/")) {
            return null;
        }

        // "/cmd@botname args" -> name="cmd", args="args"
        String withoutSlash = trimmed.substring(1);
        int spaceIdx = withoutSlash.indexOf(' ');
        String name = spaceIdx < 0 ? withoutSlash : withoutSlash.substring(0, spaceIdx);
        String args = spaceIdx < 0 ? "" : withoutSlash.substring(spaceIdx + 1).trim();
        int atIdx = name.indexOf('@');
        if (atIdx >= 0) {
            name = name.substring(0, atIdx);
        }
        name = name.toLowerCase(Locale.ROOT);

        if ("start".equals(name)) {
            return CommandResult.silent();
        }
        Command command = commands.get(name);
        if (command == null) {
            log.debug("Unknown command: /{}", name);
            return null;
        }
        log.info("{}: /{} from {}", orchestrator.transport(), name, key);
        return command.handler().handle(args, key);
    }

    private CommandResult handleNew(String args, String key) {
        orchestrator.reset(key);
        return CommandResult.text("Session reset. Next message starts fresh.");
    }

    private CommandResult handleStop(String args, String key) {
        return CommandResult.text(orchestrator.stop(key) ? "Session stopped." : "No active session.");
    }

    private CommandResult setMode(String key, ApprovalMode mode, String reply) {
        orchestrator.setApprovalMode(key, mode);
        return CommandResult.text(reply);
    }

    private CommandResult handleStatus(String args, String key) {
        StatusSnapshot snapshot = orchestrator.status(key);
        ApprovalMode mode = snapshot.entry() != null && snapshot.entry().getPermissionMode() != null
                ? snapshot.entry().getPermissionMode()
                : defaultMode;
        String modeLabel = MODE_LABELS.get(mode);
        if (snapshot.poll() == null) {
            return CommandResult.text("No active session.\nMode: " + modeLabel);
        }

        PollResult poll = snapshot.poll();
        String sessionId = snapshot.entry().getSessionId();
        String status = poll.getStatus().name().toLowerCase(Locale.ROOT);
        if (poll.getPendingInput() != null) {
            status += " (waiting: " + poll.getPendingInput().getType() + ")";
        }
        StringBuilder sb = new StringBuilder()
                .append("Session: ").append(sessionId, 0, Math.min(8, sessionId.length())).append("...\n")
                .append("Mode: ").append(modeLabel).append('\n')
                .append("Status: ").append(status);
        if (poll.getContextPercentage() != null) {
            sb.append("\nContext: ").append(Math.round(poll.getContextPercentage())).append('%');
        }
        return CommandResult.text(sb.toString());
    }

    private CommandResult handleHelp(String args, String key) {
        return CommandResult.text(commands.entrySet().stream()
                .map(e -> "/" + e.getKey() + " — " + e.getValue().description())
                .collect(Collectors.joining("\n")));
    }
}
