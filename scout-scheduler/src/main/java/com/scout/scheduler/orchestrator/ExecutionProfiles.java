package com.scout.scheduler.orchestrator;

import com.scout.executor.ApprovalMode;
import com.scout.executor.SessionExecutor.ApprovalRules;
import com.scout.executor.SessionExecutor.SessionOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Session options per trigger kind.
 * <p>
 * Scheduled runs are unattended and may read untrusted content (mail, web
 * pages), so they run without prompts but with shell patterns for network
 * egress, inline code execution and privilege escalation denied.
 */
public final class ExecutionProfiles {

    private ExecutionProfiles() {
    }

    public static final List<String> SCHEDULE_DENY = List.of(
            "curl *", "wget *", "nc *", "ncat *", "netcat *", "telnet *",
            "ssh *", "scp *", "sftp *", "rsync *", "ftp *",
            "python -c *", "python3 -c *", "node -e *", "perl -e *", "ruby -e *",
            "bash -c *", "sh -c *", "zsh -c *", "eval *", "exec *",
            "sudo *", "su *", "doas *",
            "* | sh", "* | bash", "* | sh *", "* | bash *",
            "base64 -d *", "base64 --decode *",
            "chmod +s *", "crontab *", "security *", "cat ~/.ssh/*", "cat *.env");

    /**
     * Profile for cron-fired sessions.
     *
     * @param extraDeny instance-specific patterns added to the built-in list
     */
    public static SessionOptions schedule(String cwd, List<String> extraDeny) {
        List<String> deny = new ArrayList<>(SCHEDULE_DENY);
        if (extraDeny != null) {
            deny.addAll(extraDeny);
        }
        return SessionOptions.builder()
                .cwd(cwd)
                .mode(ApprovalMode.BYPASS)
                .rules(ApprovalRules.builder().deny(List.copyOf(deny)).build())
                .build();
    }

    /**
     * Profile for channel sessions: the conversation's chosen mode, or the
     * backend default.
     */
    public static SessionOptions channel(String cwd, ApprovalMode mode) {
        return SessionOptions.builder()
                .cwd(cwd)
                .mode(mode)
                .build();
    }
}
