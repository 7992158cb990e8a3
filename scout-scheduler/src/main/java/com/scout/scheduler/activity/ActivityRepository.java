package com.scout.scheduler.activity;

/**
 * Write-only audit sink.
 */
public interface ActivityRepository {

    void append(ActivityRecord record);
}
