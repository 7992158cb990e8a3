package com.scout.scheduler.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Run state persisted under a schedule's {@code _state} key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleState {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
    public static final int DEFAULT_MAX_CONSECUTIVE_ERRORS = 5;

    private String lastRunAt;
    private String lastStatus;
    private String lastSummary;
    private int consecutiveErrors;
    @Builder.Default
    private int maxConsecutiveErrors = DEFAULT_MAX_CONSECUTIVE_ERRORS;

    /**
     * Suspended after too many failures in a row. Only an edit of the stored
     * state lifts this.
     */
    @JsonIgnore
    public boolean isAutoDisabled() {
        int max = maxConsecutiveErrors > 0 ? maxConsecutiveErrors : DEFAULT_MAX_CONSECUTIVE_ERRORS;
        return consecutiveErrors >= max;
    }
}
