package com.example.cronscheduler.schedule;

import com.example.cronscheduler.domain.enums.ScheduleKind;
import com.example.cronscheduler.exception.InvalidScheduleException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/**
 * When a job fires: either a cron expression in a time zone, or a single fixed instant.
 * <p>
 * Exactly one of the two kinds is set; the factories are the only way to build one.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class JobSchedule {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("UTC");

    private final ScheduleKind kind;
    private final CronExpression cron;
    private final ZoneId zone;
    private final Instant runAt;

    private JobSchedule(ScheduleKind kind, CronExpression cron, ZoneId zone, Instant runAt) {
        this.kind = kind;
        this.cron = cron;
        this.zone = zone;
        this.runAt = runAt;
    }

    public static JobSchedule cron(String expression, ZoneId zone) {
        return new JobSchedule(ScheduleKind.CRON, CronExpression.parse(expression),
                zone != null ? zone : DEFAULT_ZONE, null);
    }

    public static JobSchedule oneShot(Instant runAt) {
        if (runAt == null) {
            throw new InvalidScheduleException("run_at=null", "one-shot timestamp is required");
        }
        return new JobSchedule(ScheduleKind.ONE_SHOT, null, DEFAULT_ZONE, runAt);
    }

    /**
     * Build a schedule from stored or submitted fields, enforcing that exactly one kind is set.
     *
     * @param cronExpression five-field cron, or null
     * @param runAt          one-shot instant, or null
     * @param timeZone       zone id for cron evaluation, null or blank means UTC
     */
    public static JobSchedule of(String cronExpression, Instant runAt, String timeZone) {
        var hasCron = cronExpression != null && !cronExpression.isBlank();
        var hasRunAt = runAt != null;
        if (hasCron && hasRunAt) {
            throw new InvalidScheduleException(cronExpression + " / " + runAt,
                    "cron expression and one-shot timestamp are mutually exclusive");
        }
        if (!hasCron && !hasRunAt) {
            throw new InvalidScheduleException("<none>", "either a cron expression or a one-shot timestamp is required");
        }
        return hasCron ? cron(cronExpression, parseZone(timeZone)) : oneShot(runAt);
    }

    public static ZoneId parseZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException(timeZone, "unknown time zone");
        }
    }

    public boolean isRecurring() {
        return kind == ScheduleKind.CRON;
    }
}
