package com.scout.scheduler.schedule;

import com.scout.common.config.ConfigException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Trackers for the enabled schedules, rebuilt whenever a definition or the
 * time zone changes. Run state is not part of the comparison, so recording a
 * result does not reset the timers.
 */
@Slf4j
public class ScheduleTrackers {

    private final ZoneId defaultZone;
    private List<ScheduleDefinition> lastDefinitions;
    private ZoneId lastZone;
    private List<ScheduleTracker> trackers = List.of();

    public ScheduleTrackers(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public boolean sync(List<ScheduleDefinition> definitions, Instant now) {
        return sync(definitions, null, now);
    }

    /**
     * Rebuild the trackers if the definitions or the zone differ from the last
     * sync.
     *
     * @param zone zone the cron expressions are evaluated in, or null for the default
     * @return true when the trackers were rebuilt
     */
    public boolean sync(List<ScheduleDefinition> definitions, ZoneId zone, Instant now) {
        ZoneId effective = zone != null ? zone : defaultZone;
        List<ScheduleDefinition> stripped = definitions.stream()
                .map(ScheduleDefinition::withoutState)
                .collect(Collectors.toList());
        if (stripped.equals(lastDefinitions) && effective.equals(lastZone)) {
            return false;
        }
        boolean initial = lastDefinitions == null;
        lastDefinitions = stripped;
        lastZone = effective;

        List<ScheduleTracker> rebuilt = new ArrayList<>();
        for (ScheduleDefinition def : definitions) {
            if (!def.enabledOrDefault()) {
                continue;
            }
            try {
                rebuilt.add(ScheduleTracker.create(def, effective, now));
            } catch (ConfigException e) {
                log.error("Schedule {} not tracked: {}", def.getName(), e.getMessage());
            }
        }
        trackers = Collections.unmodifiableList(rebuilt);
        if (!initial) {
            log.info("Config changed, reinitializing trackers");
        }
        log.info("Tracking {} schedule(s) in {}", trackers.size(), effective);
        for (ScheduleTracker t : trackers) {
            log.info("  {}: next fire at {}", t.getName(), t.getNextFire());
        }
        return true;
    }

    public List<ScheduleTracker> trackers() {
        return trackers;
    }
}
