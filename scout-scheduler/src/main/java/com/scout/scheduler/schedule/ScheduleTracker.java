package com.scout.scheduler.schedule;

import com.scout.common.config.ConfigException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Next fire instant of one schedule.
 * <p>
 * Day fields follow classic cron: when both day-of-month and day-of-week are
 * restricted, a day matching either one fires.
 */
public class ScheduleTracker {

    private final String name;
    private final List<CronExpression> crons;
    private final ZoneId zone;
    private Instant nextFire;

    private ScheduleTracker(String name, List<CronExpression> crons, ZoneId zone, Instant now) {
        this.name = name;
        this.crons = crons;
        this.zone = zone;
        this.nextFire = nextAfter(now);
    }

    /**
     * @throws ConfigException if the cron expression does not parse or never fires
     */
    public static ScheduleTracker create(ScheduleDefinition def, ZoneId zone, Instant now) {
        ScheduleTracker tracker = new ScheduleTracker(def.getName(), parseSchedule(def.getCron()), zone, now);
        if (tracker.nextFire == null) {
            throw new ConfigException("Cron expression never fires: " + def.getCron());
        }
        return tracker;
    }

    /**
     * Parse a cron expression. Five-field expressions (minute precision) get a
     * zero seconds field prepended.
     *
     * @throws ConfigException if the expression is malformed
     */
    public static CronExpression parseCron(String expression) {
        return parse(normalize(expression), expression);
    }

    /**
     * Parse a cron expression into the expressions whose union it denotes:
     * one, or two when both day fields are restricted (one per day field).
     *
     * @throws ConfigException if the expression is malformed
     */
    public static List<CronExpression> parseSchedule(String expression) {
        String expr = normalize(expression);
        String[] fields = expr.split("\\s+");
        if (fields.length != 6 || !restricted(fields[3]) || !restricted(fields[5])) {
            return List.of(parse(expr, expression));
        }
        String[] byDayOfMonth = fields.clone();
        byDayOfMonth[5] = "*";
        String[] byDayOfWeek = fields.clone();
        byDayOfWeek[3] = "*";
        return List.of(parse(String.join(" ", byDayOfMonth), expression),
                parse(String.join(" ", byDayOfWeek), expression));
    }

    private static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigException("Missing cron expression");
        }
        String expr = expression.trim();
        if (!expr.startsWith("@") && expr.split("\\s+").length == 5) {
            expr = "0 " + expr;
        }
        return expr;
    }

    /** A day field starting with {@code *} (or {@code ?}) does not narrow the other one. */
    private static boolean restricted(String field) {
        return !field.startsWith("*") && !field.equals("?");
    }

    private static CronExpression parse(String expr, String original) {
        try {
            return CronExpression.parse(expr);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid cron expression '" + original + "': " + e.getMessage(), e);
        }
    }

    public String getName() {
        return name;
    }

    public Instant getNextFire() {
        return nextFire;
    }

    public boolean isDue(Instant now) {
        return nextFire != null && !now.isBefore(nextFire);
    }

    /**
     * Move to the first occurrence after {@code now}. Occurrences missed while
     * the process was suspended are skipped rather than fired in a burst.
     */
    public void advance(Instant now) {
        nextFire = nextAfter(now);
    }

    private Instant nextAfter(Instant instant) {
        Instant earliest = null;
        for (CronExpression cron : crons) {
            ZonedDateTime next = cron.next(instant.atZone(zone));
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }
}
