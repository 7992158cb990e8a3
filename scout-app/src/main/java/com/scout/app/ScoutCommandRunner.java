package com.scout.app;

import com.scout.app.send.SendCommand;
import com.scout.common.config.ConfigException;
import com.scout.common.config.ConfigService;
import com.scout.scheduler.SchedulerDaemon;
import com.scout.scheduler.orchestrator.RunNowResult;
import com.scout.scheduler.orchestrator.ScheduleOrchestrator;
import com.scout.scheduler.orchestrator.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Picks the mode from the command line: {@code --run-now}, {@code send}, or
 * the long-running daemon.
 */
@Slf4j
@Component
public class ScoutCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String RUN_NOW = "run-now";
    static final String SEND = "send";

    private final ConfigService configService;
    private final ScheduleOrchestrator schedules;
    private final SchedulerDaemon daemon;
    private final SendCommand sendCommand;
    private final Sleeper sleeper;
    private final Duration runNowPoll;

    private volatile boolean oneShot;
    private volatile int exitCode;

    @Autowired
    public ScoutCommandRunner(ConfigService configService, ScheduleOrchestrator schedules, SchedulerDaemon daemon,
            SendCommand sendCommand, @Value("${scout.run-now-poll:5s}") Duration runNowPoll) {
        this(configService, schedules, daemon, sendCommand, Sleeper.system(), runNowPoll);
    }

    ScoutCommandRunner(ConfigService configService, ScheduleOrchestrator schedules, SchedulerDaemon daemon,
            SendCommand sendCommand, Sleeper sleeper, Duration runNowPoll) {
        this.configService = configService;
        this.schedules = schedules;
        this.daemon = daemon;
        this.sendCommand = sendCommand;
        this.sleeper = sleeper;
        this.runNowPoll = runNowPoll;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(RUN_NOW)) {
            oneShot = true;
            exitCode = runNow(args.getOptionValues(RUN_NOW));
        } else if (args.getNonOptionArgs().contains(SEND)) {
            oneShot = true;
            exitCode = sendCommand.run(SendCommand.Request.from(args));
        } else if (!configService.exists()) {
            log.error("Config not found: {}", configService.getConfigPath());
            oneShot = true;
            exitCode = 1;
        } else {
            log.info("Instance config: {}", configService.getConfigPath());
            daemon.start();
        }
    }

    /** Whether the process should exit once {@link #run} returns. */
    public boolean isOneShot() {
        return oneShot;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int runNow(List<String> values) {
        String name = values == null || values.isEmpty() ? null : values.get(0);
        if (name == null || name.isBlank()) {
            log.error("Usage: --run-now=<schedule name>");
            return 1;
        }
        try {
            RunNowResult result = schedules.runNow(name, sleeper, runNowPoll);
            log.info("Run of {} finished: {}", name, result);
            return result.exitCode();
        } catch (ConfigException e) {
            log.error("Cannot run {}: {}", name, e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", name);
            return 1;
        }
    }
}
