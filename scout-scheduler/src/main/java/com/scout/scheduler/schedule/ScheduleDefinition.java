package com.scout.scheduler.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A named cron-triggered task from the {@code schedules} list of
 * {@code config.yaml}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleDefinition {
    private String name;
    /** Five-field (minute precision) or six-field cron expression. */
    private String cron;
    /** Skills to run, in order. */
    private List<SkillStep> skills;
    /** Skill that delivers the combined output. */
    private String output;
    /** Closing instructions; a default summary request when absent. */
    private String prompt;
    private Boolean enabled;

    @JsonProperty("_state")
    private ScheduleState state;

    /** Schedules are enabled unless {@code enabled: false} is set. */
    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }

    /** State, or a fresh one when the schedule never ran. */
    public ScheduleState stateOrDefault() {
        return state != null ? state : new ScheduleState();
    }

    /** Copy with the run state stripped, for change detection. */
    public ScheduleDefinition withoutState() {
        return toBuilder().state(null).build();
    }
}
