package com.scout.scheduler;

import com.scout.common.infra.ErrorUtils;
import com.scout.common.infra.TickRunner;
import com.scout.scheduler.channel.ChannelTransport;
import com.scout.scheduler.orchestrator.ChannelOrchestrator;
import com.scout.scheduler.orchestrator.ScheduleOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Long-running loop: a coarse timer for schedules and a fine timer for chat
 * channels. Each timer owns its own state, so a slow channel never delays a
 * schedule fire.
 */
@Slf4j
public class SchedulerDaemon implements AutoCloseable {

    /** A transport together with the orchestrator its messages go to. */
    public record ChannelRegistration(ChannelTransport transport, ChannelOrchestrator orchestrator) {
    }

    private final ScheduleOrchestrator schedules;
    private final List<ChannelRegistration> channels;
    private final TickRunner scheduleTicker;
    private final TickRunner channelTicker;

    public SchedulerDaemon(ScheduleOrchestrator schedules, List<ChannelRegistration> channels,
            Duration scheduleInterval, Duration channelInterval) {
        this.schedules = schedules;
        this.channels = List.copyOf(channels);
        this.scheduleTicker = new TickRunner("schedules", scheduleInterval, this::scheduleTick);
        this.channelTicker = new TickRunner("channels", channelInterval, this::channelTick);
    }

    public void start() {
        log.info("Scheduler daemon starting ({} channel(s) enabled)",
                channels.stream().filter(c -> c.transport().isEnabled()).count());
        scheduleTicker.start();
        channelTicker.start();
    }

    public void stop() {
        scheduleTicker.stop();
        channelTicker.stop();
    }

    public boolean isRunning() {
        return scheduleTicker.isRunning() || channelTicker.isRunning();
    }

    void scheduleTick() {
        schedules.tick();
    }

    void channelTick() {
        for (ChannelRegistration registration : channels) {
            ChannelTransport transport = registration.transport();
            try {
                registration.orchestrator().refresh();
                if (transport.isEnabled()) {
                    transport.poll();
                }
            } catch (RuntimeException e) {
                log.error("Channel {} tick failed: {}", transport.name(), ErrorUtils.formatErrorMessage(e), e);
            }
        }
    }

    @Override
    public void close() {
        scheduleTicker.close();
        channelTicker.close();
        log.info("Scheduler daemon stopped");
    }
}
