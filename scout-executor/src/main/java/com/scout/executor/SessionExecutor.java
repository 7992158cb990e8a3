package com.scout.executor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Runs agent sessions on some backend.
 * <p>
 * One backend is chosen at startup and shared by every orchestrator. Calls are
 * made from the timer threads only and a backend may assume that a given
 * session id is never driven from two threads at once.
 */
public interface SessionExecutor {

    /** Backend identifier for logs ("remote", "cli"). */
    String name();

    /**
     * Start a fresh session.
     *
     * @throws ExecutorException if the backend refuses the start
     */
    StartResult start(String message, SessionOptions options) throws ExecutorException;

    /**
     * Continue an existing session with a new message.
     *
     * @return false when the backend cannot resume that session (unknown id,
     *         previous run still alive, request refused)
     */
    boolean resume(String sessionId, String message, SessionOptions options);

    /**
     * Report the current state of a session. Never throws: connectivity
     * failures are reported as {@link SessionStatus#ERROR} with a reason.
     */
    PollResult poll(String sessionId);

    /**
     * Abort the session if it is still running and release its resources.
     * Best effort.
     */
    void cleanup(String sessionId);

    /**
     * Whether {@link #respondToInput} can resolve pending approvals.
     */
    default boolean supportsInputResponse() {
        return false;
    }

    /**
     * Answer a pending input request.
     *
     * @return true when the backend accepted the answer
     */
    default boolean respondToInput(String sessionId, String requestId, InputResponse response, String feedback) {
        return false;
    }

    // --- Supporting types ---

    enum StartStatus {
        STARTED, QUEUED
    }

    enum SessionStatus {
        RUNNING, DONE, ERROR;

        public boolean isTerminal() {
            return this != RUNNING;
        }
    }

    enum InputResponse {
        APPROVE("approve"), DENY("deny");

        private final String wireName;

        InputResponse(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class StartResult {
        /** Session id, or the queue id when the start was queued. */
        private String sessionId;
        private StartStatus status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class PollResult {
        private SessionStatus status;
        /** Set while the session waits for a human decision. */
        private PendingInput pendingInput;
        /** Context window usage in percent, when the backend reports it. */
        private Double contextPercentage;
        /** Why the poll reported an error, for logs. */
        private String reason;

        public static PollResult running() {
            return PollResult.builder().status(SessionStatus.RUNNING).build();
        }

        public static PollResult done() {
            return PollResult.builder().status(SessionStatus.DONE).build();
        }

        public static PollResult error(String reason) {
            return PollResult.builder().status(SessionStatus.ERROR).reason(reason).build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class PendingInput {
        /** Kind of request, e.g. "tool-approval". */
        private String type;
        private String toolName;
        /** Backend id needed to answer the request; may be null. */
        private String requestId;
        /** Human-readable description of what is being asked. */
        private String prompt;

        /**
         * Identity of the request as seen by a human: kind plus target.
         */
        public String signature() {
            return type + ":" + (toolName != null ? toolName : "");
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ApprovalRules {
        /** Shell patterns always allowed. */
        private List<String> allow;
        /** Shell patterns always denied; deny wins over allow. */
        private List<String> deny;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class SessionOptions {
        /** Working directory; backend default when null. */
        private String cwd;
        /** Backend default when null. */
        private ApprovalMode mode;
        private ApprovalRules rules;
    }
}
