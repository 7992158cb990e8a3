package com.scout.scheduler.activity;

import com.scout.common.infra.ErrorUtils;
import com.scout.common.infra.JsonLines;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Appends one record per completed trigger. Nothing in the scheduler reads
 * these records back.
 */
@Slf4j
public class ActivityRecorder {

    private static final int PREVIEW_CHARS = 100;

    private final ActivityRepository repository;
    private final Clock clock;

    public ActivityRecorder(ActivityRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /** Recorder backed by a JSONL file. */
    public static ActivityRecorder jsonl(Path file, Clock clock) {
        return new ActivityRecorder(record -> JsonLines.append(file, record), clock);
    }

    public void recordSchedule(String scheduleName, String status, long durationMs) {
        append(ActivityRecord.builder()
                .trigger(ActivityRecord.TRIGGER_SCHEDULE)
                .source(scheduleName)
                .status(status)
                .durationMs(durationMs)
                .build());
    }

    public void recordChannel(String transport, String status, String user, String text) {
        append(ActivityRecord.builder()
                .trigger(ActivityRecord.TRIGGER_CHANNEL)
                .source(transport)
                .status(status)
                .user(user)
                .messagePreview(ErrorUtils.preview(text, PREVIEW_CHARS))
                .build());
    }

    public void append(ActivityRecord record) {
        if (record.getTs() == null) {
            record.setTs(clock.instant().toString());
        }
        try {
            repository.append(record);
        } catch (RuntimeException e) {
            // losing an audit line must not fail the trigger it describes
            log.warn("Failed to record activity for {}: {}", record.getSource(), ErrorUtils.formatErrorMessage(e));
        }
    }
}
