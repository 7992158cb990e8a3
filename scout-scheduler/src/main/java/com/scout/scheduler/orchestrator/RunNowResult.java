package com.scout.scheduler.orchestrator;

/**
 * Outcome of firing one schedule on demand.
 */
public enum RunNowResult {

    OK(0),
    /** The backend queued the run; nothing left to wait for. */
    QUEUED(0),
    UNKNOWN_SCHEDULE(1),
    START_FAILED(1),
    /** The session ended in error or was lost. */
    SESSION_FAILED(1),
    ALREADY_RUNNING(1);

    private final int exitCode;

    RunNowResult(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
