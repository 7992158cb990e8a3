package com.scout.scheduler.activity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One completed trigger in {@code memory/activity-log.jsonl}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActivityRecord {

    public static final String TRIGGER_SCHEDULE = "schedule";
    public static final String TRIGGER_CHANNEL = "channel";

    private String ts;
    private String trigger;
    /** Schedule name or transport name. */
    private String source;
    @Builder.Default
    private String skill = "*";
    /** "ok" or "error". */
    private String status;
    private Long durationMs;
    private String user;
    private String messagePreview;
}
