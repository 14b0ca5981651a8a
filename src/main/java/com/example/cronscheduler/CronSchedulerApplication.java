package com.example.cronscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cron Scheduler Service Application
 * <p>
 * Cron-as-a-service: stores job definitions (recurring cron or one-shot),
 * claims each due occurrence exactly once across scheduler instances,
 * and delivers it as an HTTP callback with retry and backoff.
 * <p>
 * Features:
 * - Store-mediated claims (compare-and-swap) so N instances never double-dispatch
 * - Leased runs with crash recovery (at-least-once execution)
 * - Bounded retries with pluggable backoff policies
 * - Slack alerting when an occurrence fails terminally
 */
@SpringBootApplication
public class CronSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronSchedulerApplication.class, args);
    }
}
