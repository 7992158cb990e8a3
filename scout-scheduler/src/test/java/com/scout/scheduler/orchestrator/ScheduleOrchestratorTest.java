package com.scout.scheduler.orchestrator;

import com.scout.executor.ApprovalMode;
import com.scout.executor.SessionExecutor.PollResult;
import com.scout.scheduler.activity.ActivityRecord;
import com.scout.scheduler.activity.ActivityRecorder;
import com.scout.scheduler.schedule.ScheduleDefinition;
import com.scout.scheduler.schedule.ScheduleState;
import com.scout.scheduler.schedule.SkillStep;
import com.scout.scheduler.support.FakeExecutor;
import com.scout.scheduler.support.InMemoryStores;
import com.scout.scheduler.support.MutableClock;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleOrchestratorTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T07:59:30Z");
    private final FakeExecutor executor = new FakeExecutor();
    private final InMemoryStores.Schedules schedules = new InMemoryStores.Schedules();
    private final InMemoryStores.Activity activity = new InMemoryStores.Activity();
    private final ScheduleOrchestrator orchestrator = new ScheduleOrchestrator(schedules, executor,
            new ActivityRecorder(activity, clock), clock, ZoneOffset.UTC, Duration.ofSeconds(60),
            ExecutionProfiles.schedule("/srv/assistant", List.of("docker *")));

    private static ScheduleDefinition digest(String cron) {
        return ScheduleDefinition.builder()
                .name("digest")
                .cron(cron)
                .skills(List.of(new SkillStep("gmail", Map.of("label", "inbox")), new SkillStep("calendar", null)))
                .output("telegram")
                .build();
    }

    @Test
    void dueScheduleRunsToCompletionAndRecordsSuccess() {
        schedules.add(digest("0 8 * * *").toBuilder()
                .state(ScheduleState.builder().consecutiveErrors(3).build())
                .build());
        executor.script("s1", PollResult.running(), PollResult.running(), PollResult.done());

        orchestrator.tick();
        assertTrue(executor.starts.isEmpty());

        clock.set(Instant.parse("2026-03-01T08:00:00Z"));
        orchestrator.tick();
        assertEquals(1, executor.starts.size());
        assertEquals(Set.of("digest"), orchestrator.activeSchedules());

        clock.advance(Duration.ofSeconds(30));
        orchestrator.tick();
        clock.advance(Duration.ofSeconds(30));
        orchestrator.tick();

        ScheduleState state = schedules.state("digest");
        assertEquals("ok", state.getLastStatus());
        assertEquals(0, state.getConsecutiveErrors());
        assertEquals("2026-03-01T08:01:00Z", state.getLastRunAt());
        assertEquals(List.of("s1"), executor.cleanups);
        assertTrue(orchestrator.activeSchedules().isEmpty());

        assertEquals(1, activity.records.size());
        ActivityRecord record = activity.records.get(0);
        assertEquals(ActivityRecord.TRIGGER_SCHEDULE, record.getTrigger());
        assertEquals("ok", record.getStatus());
        assertEquals(60_000L, record.getDurationMs());
    }

    @Test
    void payloadAndProfileForScheduledRuns() {
        schedules.add(digest("0 8 * * *"));
        orchestrator.fire(schedules.loadAll().get(0));

        FakeExecutor.Call call = executor.starts.get(0);
        assertTrue(call.message().startsWith("ASSISTANT_TRIGGER=cron:digest\n"));
        assertTrue(call.message().contains("- gmail (args: {\"label\":\"inbox\"})"));
        assertTrue(call.message().contains("- calendar\n"));
        assertTrue(call.message().contains("Deliver the combined output via the telegram skill."));
        assertTrue(call.message().contains("When done, summarize what you did."));
        assertEquals(ApprovalMode.BYPASS, call.options().getMode());
        assertTrue(call.options().getRules().getDeny().contains("curl *"));
        assertTrue(call.options().getRules().getDeny().contains("docker *"));
    }

    @Test
    void fiveFailedRunsAutoDisableTheSchedule() {
        schedules.add(digest("* * * * *"));
        executor.pollByDefault(PollResult.error("connection refused"));
        orchestrator.tick();

        for (int run = 1; run <= 5; run++) {
            clock.advance(Duration.ofMinutes(1));
            orchestrator.tick(); // fires, first error poll
            clock.advance(Duration.ofMinutes(1));
            orchestrator.tick(); // grace window elapsed, run settles as error
            assertEquals(run, schedules.state("digest").getConsecutiveErrors());
        }
        assertTrue(schedules.state("digest").isAutoDisabled());

        clock.advance(Duration.ofMinutes(1));
        orchestrator.tick();

        assertEquals(5, executor.starts.size());
        assertEquals(5, activity.records.stream().filter(r -> "error".equals(r.getStatus())).count());
    }

    @Test
    void editingStateReenablesAnAutoDisabledSchedule() {
        schedules.add(digest("* * * * *").toBuilder()
                .state(ScheduleState.builder().consecutiveErrors(5).build())
                .build());
        orchestrator.tick();
        clock.advance(Duration.ofMinutes(1));
        orchestrator.tick();
        assertTrue(executor.starts.isEmpty());

        schedules.saveState("digest", ScheduleState.builder().consecutiveErrors(0).build());
        clock.advance(Duration.ofMinutes(1));
        orchestrator.tick();
        assertEquals(1, executor.starts.size());
    }

    @Test
    void dueScheduleWithRunInFlightIsNotFiredAgain() {
        schedules.add(digest("* * * * *"));
        orchestrator.tick();
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofMinutes(1));
            orchestrator.tick();
        }
        assertEquals(1, executor.starts.size());
    }

    @Test
    void startFailureCountsAsError() {
        schedules.add(digest("* * * * *"));
        executor.failNextStart("503 from control plane");
        orchestrator.tick();
        clock.advance(Duration.ofMinutes(1));
        orchestrator.tick();

        assertEquals(1, schedules.state("digest").getConsecutiveErrors());
        assertEquals("error", schedules.state("digest").getLastStatus());
        assertTrue(orchestrator.activeSchedules().isEmpty());
        assertEquals(0L, activity.records.get(0).getDurationMs());
    }

    @Test
    void queuedStartIsNotTracked() {
        schedules.add(digest("* * * * *"));
        executor.queueNextStart();
        orchestrator.tick();
        clock.advance(Duration.ofMinutes(1));
        orchestrator.tick();

        assertTrue(orchestrator.activeSchedules().isEmpty());
        assertNull(schedules.state("digest").getLastStatus());
    }

    @Nested
    class GraceWindow {

        @Test
        void transientErrorsInsideTheWindowAreTolerated() {
            schedules.add(digest("0 8 * * *"));
            executor.script("s1",
                    PollResult.error("timeout"),
                    PollResult.error("timeout"),
                    PollResult.running(),
                    PollResult.error("timeout"),
                    PollResult.error("timeout"),
                    PollResult.done());
            orchestrator.tick();
            clock.set(Instant.parse("2026-03-01T08:00:00Z"));

            for (int i = 0; i < 5; i++) {
                orchestrator.tick();
                clock.advance(Duration.ofSeconds(40));
            }
            assertEquals(Set.of("digest"), orchestrator.activeSchedules());

            orchestrator.tick();
            assertEquals("ok", schedules.state("digest").getLastStatus());
        }

        @Test
        void errorsPersistingThroughTheWindowSettleTheRun() {
            schedules.add(digest("0 8 * * *"));
            executor.pollByDefault(PollResult.error("gone"));
            orchestrator.tick();
            clock.set(Instant.parse("2026-03-01T08:00:00Z"));
            orchestrator.tick();
            clock.advance(Duration.ofSeconds(59));
            orchestrator.tick();
            assertEquals(Set.of("digest"), orchestrator.activeSchedules());

            clock.advance(Duration.ofSeconds(1));
            orchestrator.tick();
            assertTrue(orchestrator.activeSchedules().isEmpty());
            assertEquals(List.of("s1"), executor.cleanups);
            assertEquals(1, schedules.state("digest").getConsecutiveErrors());
        }
    }

    @Nested
    class RunNow {

        private final Sleeper sleeper = clock::advance;

        @Test
        void unknownSchedule() throws Exception {
            schedules.add(digest("0 8 * * *"));
            assertEquals(RunNowResult.UNKNOWN_SCHEDULE, orchestrator.runNow("nope", sleeper, Duration.ofSeconds(5)));
            assertEquals(1, RunNowResult.UNKNOWN_SCHEDULE.exitCode());
        }

        @Test
        void blocksUntilDoneAndRecordsState() throws Exception {
            schedules.add(digest("0 8 * * *").toBuilder()
                    .state(ScheduleState.builder().consecutiveErrors(5).build())
                    .build());
            executor.script("s1", PollResult.running(), PollResult.running(), PollResult.done());

            RunNowResult result = orchestrator.runNow("digest", sleeper, Duration.ofSeconds(5));

            assertEquals(RunNowResult.OK, result);
            assertEquals(0, result.exitCode());
            assertEquals(3, executor.pollCounts.get("s1"));
            assertEquals(0, schedules.state("digest").getConsecutiveErrors());
        }

        @Test
        void lostSessionFails() throws Exception {
            schedules.add(digest("0 8 * * *"));
            executor.pollByDefault(PollResult.error("gone"));

            assertEquals(RunNowResult.SESSION_FAILED, orchestrator.runNow("digest", sleeper, Duration.ofSeconds(5)));
            assertEquals("error", schedules.state("digest").getLastStatus());
        }

        @Test
        void startFailureAndQueuedStart() throws Exception {
            schedules.add(digest("0 8 * * *"));
            executor.failNextStart("down").queueNextStart();

            assertEquals(RunNowResult.START_FAILED, orchestrator.runNow("digest", sleeper, Duration.ofSeconds(5)));
            RunNowResult queued = orchestrator.runNow("digest", sleeper, Duration.ofSeconds(5));
            assertEquals(RunNowResult.QUEUED, queued);
            assertEquals(0, queued.exitCode());
        }
    }
}
