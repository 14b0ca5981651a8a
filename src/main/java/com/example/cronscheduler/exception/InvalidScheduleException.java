package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a malformed or unsatisfiable schedule (cron syntax, time zone,
 * missing or conflicting schedule kinds)
 */
@Getter
public class InvalidScheduleException extends RuntimeException {

    private final String schedule;

    public InvalidScheduleException(String schedule, String reason) {
        super(String.format("Invalid schedule '%s': %s", schedule, reason));
        this.schedule = schedule;
    }
}
