package com.example.cronscheduler.schedule;

import com.example.cronscheduler.domain.entity.Job;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next due instant of a schedule.
 * <p>
 * Pure and deterministic: the result depends only on the arguments, never on the
 * current time, so recovery after a crash recomputes the same occurrence.
 */
@Component
public class DueTimeCalculator {

    /**
     * Next occurrence strictly after {@code afterTime}.
     *
     * @return the occurrence, or empty when the schedule has no future occurrence
     *         (a one-shot already passed, or an unsatisfiable cron expression)
     */
    public Optional<Instant> nextOccurrence(JobSchedule schedule, Instant afterTime) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(afterTime, "afterTime");

        return switch (schedule.getKind()) {
            case ONE_SHOT -> schedule.getRunAt().isAfter(afterTime)
                    ? Optional.of(schedule.getRunAt())
                    : Optional.empty();
            case CRON -> schedule.getCron()
                    .next(afterTime.atZone(schedule.getZone()))
                    .map(next -> next.toInstant());
        };
    }

    public Optional<Instant> nextOccurrence(Job job, Instant afterTime) {
        return nextOccurrence(job.schedule(), afterTime);
    }
}
