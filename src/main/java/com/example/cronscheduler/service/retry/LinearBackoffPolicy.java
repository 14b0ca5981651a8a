package com.example.cronscheduler.service.retry;

/**
 * {@code base * attempt}, capped at the ceiling
 */
public class LinearBackoffPolicy implements BackoffPolicy {

    private final long maxBackoffMs;

    public LinearBackoffPolicy(long maxBackoffMs) {
        if (maxBackoffMs < 0) {
            throw new IllegalArgumentException("maxBackoffMs must be >= 0");
        }
        this.maxBackoffMs = maxBackoffMs;
    }

    @Override
    public long delayMs(int attempt, long baseMs) {
        if (baseMs <= 0) {
            return 0;
        }
        var factor = Math.max(attempt, 1);
        if (baseMs > Long.MAX_VALUE / factor) {
            return maxBackoffMs;
        }
        return Math.min(baseMs * factor, maxBackoffMs);
    }
}
