package com.scout.scheduler.orchestrator;

import com.scout.common.infra.ErrorUtils;
import com.scout.executor.ExecutorException;
import com.scout.executor.SessionExecutor;
import com.scout.executor.SessionExecutor.PollResult;
import com.scout.executor.SessionExecutor.SessionOptions;
import com.scout.executor.SessionExecutor.SessionStatus;
import com.scout.executor.SessionExecutor.StartResult;
import com.scout.executor.SessionExecutor.StartStatus;
import com.scout.scheduler.activity.ActivityRecorder;
import com.scout.scheduler.schedule.ScheduleDefinition;
import com.scout.scheduler.schedule.ScheduleRepository;
import com.scout.scheduler.schedule.ScheduleState;
import com.scout.scheduler.schedule.ScheduleTracker;
import com.scout.scheduler.schedule.ScheduleTrackers;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fires due schedules and drives their sessions to completion.
 * <p>
 * At most one session per schedule name is in flight. A schedule whose
 * consecutive error count reached its maximum is not fired again until its
 * stored state is edited.
 */
@Slf4j
public class ScheduleOrchestrator {

    enum FireOutcome {
        STARTED, QUEUED, FAILED
    }

    static final class ActiveRun {
        final String scheduleName;
        final String sessionId;
        final Instant startedAt;
        Instant firstErrorAt;

        ActiveRun(String scheduleName, String sessionId, Instant startedAt) {
            this.scheduleName = scheduleName;
            this.sessionId = sessionId;
            this.startedAt = startedAt;
        }
    }

    private final ScheduleRepository repository;
    private final SessionExecutor executor;
    private final ActivityRecorder activity;
    private final Clock clock;
    private final Duration graceWindow;
    private final SessionOptions profile;
    private final ScheduleTrackers trackers;
    private final Map<String, ActiveRun> active = new LinkedHashMap<>();

    public ScheduleOrchestrator(ScheduleRepository repository, SessionExecutor executor, ActivityRecorder activity,
            Clock clock, ZoneId zone, Duration graceWindow, SessionOptions profile) {
        this.repository = repository;
        this.executor = executor;
        this.activity = activity;
        this.clock = clock;
        this.graceWindow = graceWindow;
        this.profile = profile;
        this.trackers = new ScheduleTrackers(zone);
    }

    /**
     * One coarse tick: re-read the schedules and zone, fire the due ones, then poll
     * every session in flight.
     */
    public synchronized void tick() {
        Instant now = clock.instant();
        List<ScheduleDefinition> definitions = repository.loadAll();
        trackers.sync(definitions, repository.loadZone(), now);
        Map<String, ScheduleDefinition> byName = definitions.stream()
                .collect(Collectors.toMap(ScheduleDefinition::getName, d -> d, (a, b) -> b));

        for (ScheduleTracker tracker : trackers.trackers()) {
            if (!tracker.isDue(now)) {
                continue;
            }
            String name = tracker.getName();
            try {
                ScheduleDefinition def = byName.get(name);
                if (def == null) {
                    continue;
                }
                if (def.stateOrDefault().isAutoDisabled()) {
                    log.debug("Skipping {}: auto-disabled", name);
                } else if (active.containsKey(name)) {
                    log.debug("Skipping {}: previous run still active", name);
                } else {
                    fire(def);
                }
            } catch (RuntimeException e) {
                log.error("Schedule {} failed: {}", name, ErrorUtils.formatErrorMessage(e), e);
            } finally {
                tracker.advance(now);
                log.info("  {}: next fire at {}", name, tracker.getNextFire());
            }
        }

        pollActive();
    }

    /**
     * Fire one schedule immediately and block until its session ends. Uses the
     * same fire, poll and state-update path as timer-driven runs, and ignores
     * auto-disable.
     */
    public RunNowResult runNow(String scheduleName, Sleeper sleeper, Duration pollInterval)
            throws InterruptedException {
        ActiveRun run;
        synchronized (this) {
            List<ScheduleDefinition> definitions = repository.loadAll();
            ScheduleDefinition def = definitions.stream()
                    .filter(d -> scheduleName.equals(d.getName()))
                    .findFirst()
                    .orElse(null);
            if (def == null) {
                log.error("Schedule \"{}\" not found. Available: {}", scheduleName,
                        definitions.isEmpty() ? "none"
                                : definitions.stream().map(ScheduleDefinition::getName)
                                        .collect(Collectors.joining(", ")));
                return RunNowResult.UNKNOWN_SCHEDULE;
            }
            if (active.containsKey(scheduleName)) {
                return RunNowResult.ALREADY_RUNNING;
            }
            log.info("Running schedule immediately: {}", scheduleName);
            FireOutcome outcome = fire(def);
            if (outcome == FireOutcome.FAILED) {
                return RunNowResult.START_FAILED;
            }
            if (outcome == FireOutcome.QUEUED) {
                log.info("No session to track (queued)");
                return RunNowResult.QUEUED;
            }
            run = active.get(scheduleName);
        }

        log.info("Waiting for session to complete...");
        while (true) {
            sleeper.sleep(pollInterval);
            SessionStatus status;
            synchronized (this) {
                status = pollRun(run);
            }
            if (status == SessionStatus.DONE) {
                return RunNowResult.OK;
            }
            if (status == SessionStatus.ERROR) {
                return RunNowResult.SESSION_FAILED;
            }
        }
    }

    /** Names of schedules with a session in flight. */
    public synchronized Set<String> activeSchedules() {
        return Set.copyOf(active.keySet());
    }

    FireOutcome fire(ScheduleDefinition def) {
        String name = def.getName();
        log.info("Firing schedule: {}", name);
        StartResult result;
        try {
            result = executor.start(TaskPayloads.schedule(def), profile);
        } catch (ExecutorException e) {
            log.warn("  Start of {} failed: {}", name, e.getMessage());
            recordResult(name, ScheduleState.STATUS_ERROR, 0);
            return FireOutcome.FAILED;
        }
        if (result.getStatus() == StartStatus.QUEUED) {
            log.info("  {} queued as {}", name, result.getSessionId());
            return FireOutcome.QUEUED;
        }
        active.put(name, new ActiveRun(name, result.getSessionId(), clock.instant()));
        log.info("  Session started: {}", result.getSessionId());
        return FireOutcome.STARTED;
    }

    private void pollActive() {
        for (ActiveRun run : new ArrayList<>(active.values())) {
            try {
                pollRun(run);
            } catch (RuntimeException e) {
                log.error("Polling {} failed: {}", run.scheduleName, ErrorUtils.formatErrorMessage(e), e);
            }
        }
    }

    /**
     * Poll one run and settle it when it reached a terminal state.
     *
     * @return DONE or ERROR once settled, RUNNING otherwise (including
     *         errors still inside the grace window)
     */
    private SessionStatus pollRun(ActiveRun run) {
        PollResult result = executor.poll(run.sessionId);
        Instant now = clock.instant();
        switch (result.getStatus()) {
            case DONE -> {
                log.info("Session completed: {} ({}s)", run.scheduleName,
                        Duration.between(run.startedAt, now).toSeconds());
                settle(run, ScheduleState.STATUS_OK, now);
                return SessionStatus.DONE;
            }
            case ERROR -> {
                if (run.firstErrorAt == null) {
                    run.firstErrorAt = now;
                    log.warn("Poll of {} failed: {}", run.scheduleName, result.getReason());
                }
                if (Duration.between(run.firstErrorAt, now).compareTo(graceWindow) >= 0) {
                    log.warn("Session error/lost: {}", run.scheduleName);
                    settle(run, ScheduleState.STATUS_ERROR, now);
                    return SessionStatus.ERROR;
                }
                return SessionStatus.RUNNING;
            }
            default -> {
                run.firstErrorAt = null;
                return SessionStatus.RUNNING;
            }
        }
    }

    private void settle(ActiveRun run, String status, Instant now) {
        active.remove(run.scheduleName);
        try {
            executor.cleanup(run.sessionId);
        } catch (RuntimeException e) {
            log.warn("Cleanup of {} failed: {}", run.sessionId, ErrorUtils.formatErrorMessage(e));
        }
        recordResult(run.scheduleName, status, Duration.between(run.startedAt, now).toMillis());
    }

    private void recordResult(String scheduleName, String status, long durationMs) {
        ScheduleDefinition def = repository.loadAll().stream()
                .filter(d -> scheduleName.equals(d.getName()))
                .findFirst()
                .orElse(null);
        if (def == null) {
            log.warn("Schedule {} no longer configured; result {} not stored", scheduleName, status);
        } else {
            ScheduleState state = def.stateOrDefault();
            state.setLastRunAt(clock.instant().toString());
            state.setLastStatus(status);
            if (ScheduleState.STATUS_OK.equals(status)) {
                state.setConsecutiveErrors(0);
            } else {
                state.setConsecutiveErrors(state.getConsecutiveErrors() + 1);
            }
            repository.saveState(scheduleName, state);
            if (state.isAutoDisabled()) {
                log.warn("Schedule {} auto-disabled after {} consecutive errors", scheduleName,
                        state.getConsecutiveErrors());
            }
        }
        activity.recordSchedule(scheduleName, status, durationMs);
    }
}
