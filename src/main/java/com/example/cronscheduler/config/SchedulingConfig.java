package com.example.cronscheduler.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns the scheduler, worker and housekeeping loops on.
 * Set {@code cron-scheduler.scheduling.enabled=false} to run the API only (and in tests).
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "cron-scheduler.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
