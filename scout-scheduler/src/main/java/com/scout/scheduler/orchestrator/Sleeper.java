package com.scout.scheduler.orchestrator;

import java.time.Duration;

/**
 * Blocking wait between polls of a run started with "run now".
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
