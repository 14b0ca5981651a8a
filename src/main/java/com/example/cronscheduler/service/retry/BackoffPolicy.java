package com.example.cronscheduler.service.retry;

/**
 * Delay before the next callback attempt of a run.
 * <p>
 * Implementations are pure apart from jitter and never return more than their ceiling.
 */
public interface BackoffPolicy {

    /**
     * @param attempt the attempt that just failed, starting at 1
     * @param baseMs  the job's backoff base
     * @return delay in milliseconds, between 0 and the configured ceiling
     */
    long delayMs(int attempt, long baseMs);
}
