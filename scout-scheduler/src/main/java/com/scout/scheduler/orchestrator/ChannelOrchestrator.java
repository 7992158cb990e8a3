package com.scout.scheduler.orchestrator;

import com.scout.common.infra.ErrorUtils;
import com.scout.executor.ApprovalMode;
import com.scout.executor.ExecutorException;
import com.scout.executor.SessionExecutor;
import com.scout.executor.SessionExecutor.InputResponse;
import com.scout.executor.SessionExecutor.PendingInput;
import com.scout.executor.SessionExecutor.PollResult;
import com.scout.executor.SessionExecutor.SessionOptions;
import com.scout.executor.SessionExecutor.SessionStatus;
import com.scout.executor.SessionExecutor.StartResult;
import com.scout.executor.SessionExecutor.StartStatus;
import com.scout.scheduler.activity.ActivityRecorder;
import com.scout.scheduler.channel.ApprovalPrompt;
import com.scout.scheduler.channel.ChannelNotifier;
import com.scout.scheduler.channel.ChannelUser;
import com.scout.scheduler.history.ChatHistory;
import com.scout.scheduler.history.ChatMessage;
import com.scout.scheduler.session.SessionKeyEntry;
import com.scout.scheduler.session.SessionKeyStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns inbound channel messages into sessions for one transport.
 * <p>
 * Each conversation key has at most one session in flight. A message that
 * arrives while its key is busy is held back and sent once the session ends.
 * While a session runs, its pending approvals and context usage are relayed to
 * the chat, each at most once.
 */
@Slf4j
public class ChannelOrchestrator {

    public static final String START_FAILURE_REPLY =
            "Sorry, I couldn't start a session right now. Try again in a moment.";
    static final double USAGE_WARNING_PERCENT = 60.0;
    private static final int PROMPT_DETAIL_CHARS = 200;

    public enum DispatchOutcome {
        RESUMED, STARTED, QUEUED, DEFERRED, FAILED
    }

    /**
     * Transport-level settings.
     *
     * @param transport     transport name, used in payloads and logs
     * @param sendCommand   command prefix an agent runs to reply
     * @param assistantName how the assistant appears in history
     * @param cwd           working directory for sessions, backend default when null
     * @param graceWindow   how long poll errors must persist before a session counts as lost
     */
    public record Settings(String transport, String sendCommand, String assistantName, String cwd,
            Duration graceWindow) {
    }

    /**
     * Answer to an approval button press.
     *
     * @param accepted whether the session took the decision
     * @param text     what the prompt should now read
     */
    public record ApprovalResolution(boolean accepted, String text) {
        static ApprovalResolution stale() {
            return new ApprovalResolution(false, "⚠ Already handled");
        }
    }

    /** Stored entry and live state of a key, for status displays. */
    public record StatusSnapshot(SessionKeyEntry entry, PollResult poll) {
    }

    private record PendingMessage(ChannelUser user, String text, List<String> attachments) {
    }

    private static final class RelayedApproval {
        final String signature;
        final String requestId;
        final String promptRef;
        final String toolInfo;
        boolean answered;

        RelayedApproval(String signature, String requestId, String promptRef, String toolInfo) {
            this.signature = signature;
            this.requestId = requestId;
            this.promptRef = promptRef;
            this.toolInfo = toolInfo;
        }
    }

    private static final class ChatSession {
        final String sessionId;
        Instant firstErrorAt;
        RelayedApproval relayed;
        boolean usageWarned;

        ChatSession(String sessionId) {
            this.sessionId = sessionId;
        }
    }

    private final Settings settings;
    private final SessionExecutor executor;
    private final SessionKeyStore keyStore;
    private final ChatHistory history;
    private final ActivityRecorder activity;
    private final ChannelNotifier notifier;
    private final Clock clock;
    private final Map<String, ChatSession> active = new LinkedHashMap<>();
    private final Map<String, List<PendingMessage>> deferred = new LinkedHashMap<>();

    public ChannelOrchestrator(Settings settings, SessionExecutor executor, SessionKeyStore keyStore,
            ChatHistory history, ActivityRecorder activity, ChannelNotifier notifier, Clock clock) {
        this.settings = settings;
        this.executor = executor;
        this.keyStore = keyStore;
        this.history = history;
        this.activity = activity;
        this.notifier = notifier;
        this.clock = clock;
    }

    public String transport() {
        return settings.transport();
    }

    public SessionKeyStore keyStore() {
        return keyStore;
    }

    /**
     * Handle one inbound message: resume today's session for the key, or
     * start a fresh one when there is none or the resume is refused.
     */
    public synchronized DispatchOutcome dispatch(ChannelUser user, String text, List<String> attachments) {
        String key = user.chatId();
        if (active.containsKey(key)) {
            deferred.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(new PendingMessage(user, text, attachments != null ? attachments : List.of()));
            log.info("{}: session for {} busy, message held back", transport(), user.name());
            safeIndicator(key);
            return DispatchOutcome.DEFERRED;
        }
        return launch(user, text, attachments != null ? attachments : List.of());
    }

    /**
     * One channel tick for this transport: poll every session in flight,
     * keep indicators alive, relay approvals and usage, settle finished runs.
     */
    public synchronized void refresh() {
        for (String key : new ArrayList<>(active.keySet())) {
            try {
                refreshOne(key);
            } catch (RuntimeException e) {
                log.error("{}: refresh of {} failed: {}", transport(), key, ErrorUtils.formatErrorMessage(e), e);
            }
        }
    }

    /**
     * Answer the approval last relayed for {@code key}. A press on any other
     * prompt than the one last relayed is stale.
     *
     * @param promptRef reference of the prompt the answer was given on
     */
    public synchronized ApprovalResolution respondToApproval(String key, String promptRef, InputResponse decision) {
        ChatSession session = active.get(key);
        RelayedApproval relayed = session != null ? session.relayed : null;
        if (relayed == null || relayed.requestId == null || relayed.answered
                || promptRef == null || !promptRef.equals(relayed.promptRef)) {
            return ApprovalResolution.stale();
        }
        boolean accepted = executor.respondToInput(session.sessionId, relayed.requestId, decision, null);
        relayed.answered = true;
        String label = decision == InputResponse.APPROVE
                ? "✓ Approved: " + relayed.toolInfo
                : "✗ Denied: " + relayed.toolInfo;
        log.info("{}: {} for {} ({})", transport(), label, key, accepted ? "accepted" : "not accepted");
        return new ApprovalResolution(accepted, accepted ? label : "⚠ " + label + " (already handled)");
    }

    /**
     * Abort the key's session and forget it. The approval mode is kept.
     *
     * @return false when there was no session to stop
     */
    public synchronized boolean stop(String key) {
        ChatSession session = active.remove(key);
        deferred.remove(key);
        String sessionId = session != null ? session.sessionId : keyStore.get(key);
        if (sessionId == null) {
            return false;
        }
        executor.cleanup(sessionId);
        forget(key);
        log.info("{}: session {} stopped for {}", transport(), sessionId, key);
        return true;
    }

    /**
     * Make the next message start a fresh session. A run in flight is left to
     * finish. The approval mode is kept.
     */
    public synchronized void reset(String key) {
        forget(key);
        log.info("{}: session reset for {}", transport(), key);
    }

    public synchronized void setApprovalMode(String key, ApprovalMode mode) {
        keyStore.setApprovalMode(key, mode);
    }

    public synchronized StatusSnapshot status(String key) {
        SessionKeyEntry entry = keyStore.getEntry(key);
        if (entry == null || entry.getSessionId() == null) {
            return new StatusSnapshot(entry, null);
        }
        return new StatusSnapshot(entry, executor.poll(entry.getSessionId()));
    }

    public synchronized boolean isActive(String key) {
        return active.containsKey(key);
    }

    private DispatchOutcome launch(ChannelUser user, String text, List<String> attachments) {
        String key = user.chatId();
        List<ChatMessage> recent = history.loadRecent(key);
        history.append(ChatMessage.builder()
                .ts(clock.instant().toString())
                .role(ChatMessage.ROLE_USER)
                .name(user.name())
                .key(key)
                .text(text)
                .build());

        safeIndicator(key);
        ApprovalMode mode = keyStore.approvalMode(key);
        SessionOptions options = ExecutionProfiles.channel(settings.cwd(), mode);

        DispatchOutcome outcome;
        String existing = keyStore.get(key);
        if (existing != null && executor.resume(existing, TaskPayloads.resume(text, attachments), options)) {
            log.info("{} session resumed: {}", transport(), existing);
            active.put(key, new ChatSession(existing));
            outcome = DispatchOutcome.RESUMED;
        } else {
            if (existing != null) {
                log.warn("{}: resume of {} refused, starting fresh", transport(), existing);
                keyStore.clear(key);
            }
            outcome = startFresh(user, text, attachments, recent, mode, options);
        }

        activity.recordChannel(transport(), outcome == DispatchOutcome.FAILED ? "error" : "ok", user.name(), text);
        return outcome;
    }

    private DispatchOutcome startFresh(ChannelUser user, String text, List<String> attachments,
            List<ChatMessage> recent, ApprovalMode mode, SessionOptions options) {
        String key = user.chatId();
        String payload = TaskPayloads.channel(transport(), user, settings.sendCommand(), settings.assistantName(),
                recent, attachments, text);
        try {
            StartResult result = executor.start(payload, options);
            if (result.getStatus() == StartStatus.QUEUED) {
                log.info("{} session queued", transport());
                return DispatchOutcome.QUEUED;
            }
            keyStore.set(key, result.getSessionId(), mode);
            active.put(key, new ChatSession(result.getSessionId()));
            log.info("{} session started: {}", transport(), result.getSessionId());
            return DispatchOutcome.STARTED;
        } catch (ExecutorException e) {
            log.warn("{} session failed: {}", transport(), e.getMessage());
            safeReply(key, START_FAILURE_REPLY);
            return DispatchOutcome.FAILED;
        }
    }

    private void refreshOne(String key) {
        ChatSession session = active.get(key);
        PollResult result = executor.poll(session.sessionId);
        Instant now = clock.instant();

        if (result.getStatus() == SessionStatus.ERROR) {
            if (session.firstErrorAt == null) {
                session.firstErrorAt = now;
                log.warn("{}: poll of {} failed: {}", transport(), session.sessionId, result.getReason());
            }
            if (Duration.between(session.firstErrorAt, now).compareTo(settings.graceWindow()) >= 0) {
                log.warn("{}: session {} lost", transport(), session.sessionId);
                settle(key, session);
            }
            return;
        }
        session.firstErrorAt = null;

        if (result.getStatus() == SessionStatus.RUNNING) {
            safeIndicator(key);
            relayApproval(key, session, result.getPendingInput());
        }
        warnUsage(key, session, result.getContextPercentage());

        if (result.getStatus() == SessionStatus.DONE) {
            log.info("{}: session {} finished", transport(), session.sessionId);
            settle(key, session);
        }
    }

    private void relayApproval(String key, ChatSession session, PendingInput pending) {
        RelayedApproval relayed = session.relayed;
        if (pending == null) {
            if (relayed != null) {
                if (!relayed.answered && relayed.promptRef != null) {
                    notifier.markApprovalResolved(key, relayed.promptRef, relayed.toolInfo);
                }
                session.relayed = null;
            }
            return;
        }
        String signature = pending.signature();
        if (relayed != null && signature.equals(relayed.signature)) {
            return;
        }
        if (relayed != null && !relayed.answered && relayed.promptRef != null) {
            notifier.markApprovalResolved(key, relayed.promptRef, relayed.toolInfo);
        }
        String toolInfo = pending.getToolName() != null ? pending.getToolName() : "Tool";
        boolean interactive = executor.supportsInputResponse() && pending.getRequestId() != null;
        String detail = pending.getPrompt() != null ? ErrorUtils.preview(pending.getPrompt(), PROMPT_DETAIL_CHARS) : null;
        String ref = notifier.sendApprovalPrompt(key, new ApprovalPrompt(toolInfo, detail, interactive));
        session.relayed = new RelayedApproval(signature, interactive ? pending.getRequestId() : null, ref, toolInfo);
        log.info("{}: relayed approval request {} for {}", transport(), signature, key);
    }

    private void warnUsage(String key, ChatSession session, Double percentage) {
        if (percentage == null || session.usageWarned || percentage < USAGE_WARNING_PERCENT) {
            return;
        }
        session.usageWarned = true;
        safeReply(key, "Context at " + Math.round(percentage)
                + "%. Quality may degrade — send /new to start a fresh session.");
    }

    private void settle(String key, ChatSession session) {
        active.remove(key);
        try {
            executor.cleanup(session.sessionId);
        } catch (RuntimeException e) {
            log.warn("Cleanup of {} failed: {}", session.sessionId, ErrorUtils.formatErrorMessage(e));
        }
        List<PendingMessage> held = deferred.remove(key);
        if (held == null || held.isEmpty()) {
            return;
        }
        List<String> texts = new ArrayList<>();
        List<String> attachments = new ArrayList<>();
        for (PendingMessage m : held) {
            texts.add(m.text());
            attachments.addAll(m.attachments());
        }
        ChannelUser user = held.get(held.size() - 1).user();
        log.info("{}: sending {} held message(s) for {}", transport(), held.size(), user.name());
        launch(user, String.join("\n\n", texts), attachments);
    }

    private void forget(String key) {
        ApprovalMode mode = keyStore.approvalMode(key);
        keyStore.clear(key);
        if (mode != null) {
            keyStore.setApprovalMode(key, mode);
        }
    }

    private void safeReply(String key, String text) {
        try {
            notifier.sendReply(key, text);
        } catch (RuntimeException e) {
            log.warn("{}: reply to {} failed: {}", transport(), key, ErrorUtils.formatErrorMessage(e));
        }
    }

    private void safeIndicator(String key) {
        try {
            notifier.sendIndicator(key);
        } catch (RuntimeException e) {
            log.debug("{}: indicator for {} failed: {}", transport(), key, e.getMessage());
        }
    }
}
