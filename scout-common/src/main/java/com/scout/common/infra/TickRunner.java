package com.scout.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative timer: runs one action on its own thread with a fixed delay
 * between the end of one tick and the start of the next.
 * <p>
 * Ticks never overlap, and an exception thrown by the action is logged and
 * swallowed at the tick boundary so the loop keeps going.
 */
@Slf4j
public class TickRunner implements AutoCloseable {

    private final String name;
    private final Duration interval;
    private final Runnable action;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    public TickRunner(String name, Duration interval, Runnable action) {
        this.name = name;
        this.interval = interval;
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tick-" + name);
            // keeps the process alive while the daemon runs
            t.setDaemon(false);
            return t;
        });
    }

    /**
     * Start ticking. The first tick runs immediately.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Tick runner {} already running", name);
            return;
        }
        scheduledTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Tick runner {} started (interval: {}ms)", name, interval.toMillis());
    }

    /**
     * Stop ticking. A tick in progress is allowed to finish.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        log.info("Tick runner {} stopped", name);
    }

    /**
     * Run one tick on the calling thread, outside the schedule.
     */
    public void runOnce() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Tick {} failed: {}", name, ErrorUtils.formatErrorMessage(e), e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
