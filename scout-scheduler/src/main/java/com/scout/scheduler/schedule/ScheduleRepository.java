package com.scout.scheduler.schedule;

import java.time.ZoneId;
import java.util.List;

/**
 * Source of schedule definitions and sink for their run state.
 */
public interface ScheduleRepository {

    /** Every configured schedule, re-read on each call. */
    List<ScheduleDefinition> loadAll();

    /** Replace the stored run state of one schedule. */
    void saveState(String scheduleName, ScheduleState state);

    /** Zone the cron expressions are evaluated in, re-read on each call; null for the caller's default. */
    default ZoneId loadZone() {
        return null;
    }
}
