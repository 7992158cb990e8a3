package com.scout.app.config;

import com.scout.app.send.SendCommand;
import com.scout.channel.telegram.TelegramApi;
import com.scout.channel.telegram.TelegramNotifier;
import com.scout.channel.telegram.TelegramTransport;
import com.scout.channel.telegram.TelegramUpdateOffsetStore;
import com.scout.channel.transcription.TranscriptionService;
import com.scout.common.config.ConfigService;
import com.scout.common.config.InstancePaths;
import com.scout.common.config.ScoutConfig;
import com.scout.common.infra.DotEnv;
import com.scout.executor.ApprovalMode;
import com.scout.executor.ExecutorFactory;
import com.scout.executor.SessionExecutor;
import com.scout.scheduler.SchedulerDaemon;
import com.scout.scheduler.SchedulerDaemon.ChannelRegistration;
import com.scout.scheduler.activity.ActivityRecorder;
import com.scout.scheduler.command.ChannelCommands;
import com.scout.scheduler.history.ChatHistory;
import com.scout.scheduler.history.JsonlHistoryRepository;
import com.scout.scheduler.orchestrator.ChannelOrchestrator;
import com.scout.scheduler.orchestrator.ExecutionProfiles;
import com.scout.scheduler.orchestrator.ScheduleOrchestrator;
import com.scout.scheduler.schedule.ConfigScheduleRepository;
import com.scout.scheduler.session.JsonSessionKeyRepository;
import com.scout.scheduler.session.SessionKeyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.system.ApplicationHome;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Spring configuration for the scheduler daemon and its collaborators. The
 * instance directory comes from {@code --instance}, else the environment.
 */
@Slf4j
@Configuration
public class ScoutBeanConfig {

    @Value("${instance:}")
    private String instance;
    @Value("${scout.schedule-tick:30s}")
    private Duration scheduleTick;
    @Value("${scout.channel-tick:5s}")
    private Duration channelTick;
    @Value("${scout.grace-window:60s}")
    private Duration graceWindow;

    @Bean
    public InstancePaths instancePaths() {
        InstancePaths paths = InstancePaths.resolve(instance);
        log.info("Instance directory: {}", paths);
        return paths;
    }

    @Bean
    public DotEnv dotEnv(InstancePaths paths) {
        return DotEnv.load(paths.envFile());
    }

    @Bean
    public ConfigService configService(InstancePaths paths) {
        return new ConfigService(paths.configFile());
    }

    /**
     * Startup view of the config: backend choice, channel and transcription
     * settings. Schedules are re-read on every tick instead.
     */
    @Bean
    public ScoutConfig scoutConfig(ConfigService configService) {
        if (!configService.exists()) {
            log.warn("No config at {}, using defaults", configService.getConfigPath());
            return new ScoutConfig();
        }
        return configService.loadConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionExecutor sessionExecutor(ScoutConfig config, InstancePaths paths) {
        return ExecutorFactory.create(config.getExecutor(), paths);
    }

    @Bean
    public ActivityRecorder activityRecorder(InstancePaths paths, Clock clock) {
        return ActivityRecorder.jsonl(paths.activityLog(), clock);
    }

    @Bean
    public ScheduleOrchestrator scheduleOrchestrator(ConfigService configService, SessionExecutor executor,
            ActivityRecorder activity, ScoutConfig config, Clock clock) {
        ScoutConfig.ExecutorSettings executorSettings = executorSettings(config);
        return new ScheduleOrchestrator(new ConfigScheduleRepository(configService), executor, activity, clock,
                ZoneId.of(config.getTimezone()), graceWindow,
                ExecutionProfiles.schedule(executorSettings.getCwd(), executorSettings.getScheduleDeny()));
    }

    // --- Telegram ---

    @Bean
    public TelegramApi telegramApi(DotEnv env) {
        String token = env.get("TELEGRAM_BOT_TOKEN");
        return new TelegramApi(token != null ? token : "");
    }

    @Bean
    public TelegramNotifier telegramNotifier(TelegramApi api) {
        return new TelegramNotifier(api);
    }

    @Bean
    public ChannelOrchestrator telegramOrchestrator(ScoutConfig config, InstancePaths paths, SessionExecutor executor,
            ActivityRecorder activity, TelegramNotifier notifier, Clock clock) {
        ScoutConfig.TelegramSettings telegram = telegramSettings(config);
        String sendCommand = telegram != null && telegram.getSendCommand() != null
                ? telegram.getSendCommand()
                : defaultSendCommand(paths);
        return new ChannelOrchestrator(
                new ChannelOrchestrator.Settings(TelegramTransport.NAME, sendCommand, config.getAssistantName(),
                        executorSettings(config).getCwd(), graceWindow),
                executor,
                new SessionKeyStore(new JsonSessionKeyRepository(paths.sessionsFile(TelegramTransport.NAME)), clock),
                new ChatHistory(new JsonlHistoryRepository(paths.historyFile(TelegramTransport.NAME))),
                activity,
                notifier,
                clock);
    }

    @Bean
    public TranscriptionService transcriptionService(ScoutConfig config, DotEnv env) {
        return TranscriptionService.fromSettings(
                config.getSkills() != null ? config.getSkills().getTranscription() : null, env);
    }

    @Bean
    public TelegramTransport telegramTransport(ScoutConfig config, InstancePaths paths, DotEnv env, TelegramApi api,
            ChannelOrchestrator telegramOrchestrator, TelegramNotifier notifier,
            TranscriptionService transcription) {
        ApprovalMode defaultMode = ApprovalMode.fromString(executorSettings(config).getPermissionMode());
        TelegramTransport transport = new TelegramTransport(api,
                new TelegramUpdateOffsetStore(paths.offsetFile(TelegramTransport.NAME)),
                TelegramTransport.resolveUsers(telegramSettings(config), env),
                telegramOrchestrator,
                new ChannelCommands(telegramOrchestrator, defaultMode),
                notifier,
                transcription,
                paths::attachmentsDir,
                env.get("TELEGRAM_BOT_TOKEN") != null);
        log.info("Telegram channel {}", transport.isEnabled() ? "enabled" : "disabled (no token or no users)");
        return transport;
    }

    // --- Daemon and control surface ---

    @Bean
    public SchedulerDaemon schedulerDaemon(ScheduleOrchestrator scheduleOrchestrator,
            TelegramTransport telegramTransport, ChannelOrchestrator telegramOrchestrator) {
        return new SchedulerDaemon(scheduleOrchestrator,
                List.of(new ChannelRegistration(telegramTransport, telegramOrchestrator)),
                scheduleTick, channelTick);
    }

    @Bean
    public SendCommand sendCommand(InstancePaths paths, DotEnv env, ScoutConfig config, Clock clock) {
        return new SendCommand(paths, env, config.getAssistantName(), clock, TelegramApi.DEFAULT_API_BASE);
    }

    private static ScoutConfig.ExecutorSettings executorSettings(ScoutConfig config) {
        return config.getExecutor() != null ? config.getExecutor() : new ScoutConfig.ExecutorSettings();
    }

    private static ScoutConfig.TelegramSettings telegramSettings(ScoutConfig config) {
        return config.getSkills() != null ? config.getSkills().getTelegram() : null;
    }

    /**
     * How an agent calls back into this installation to reply: the running
     * jar when there is one, else a {@code scout} launcher on the PATH.
     */
    static String defaultSendCommand(InstancePaths paths) {
        File source = new ApplicationHome(ScoutBeanConfig.class).getSource();
        String launcher = source != null && source.getName().endsWith(".jar")
                ? "java -jar " + source.getAbsolutePath()
                : "scout";
        return InstancePaths.INSTANCE_DIR_ENV + "=" + paths.root() + " " + launcher + " send --transport="
                + TelegramTransport.NAME;
    }
}
