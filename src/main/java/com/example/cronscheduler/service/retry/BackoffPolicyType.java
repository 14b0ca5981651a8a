package com.example.cronscheduler.service.retry;

/**
 * Backoff curves selectable through {@code cron-scheduler.retry.policy}
 */
public enum BackoffPolicyType {
    EXPONENTIAL,
    LINEAR,
    JITTERED
}
