package com.example.cronscheduler.domain.enums;

/**
 * Kind of schedule a job carries. Exactly one applies per job.
 */
public enum ScheduleKind {

    /**
     * Recurring, five-field cron expression evaluated in the job time zone
     */
    CRON,

    /**
     * Single fixed timestamp
     */
    ONE_SHOT
}
