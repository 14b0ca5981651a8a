package com.example.cronscheduler.service.retry;

/**
 * {@code base * 2^(attempt-1)}, capped at the ceiling. Non-decreasing in attempt,
 * and saturates at the ceiling instead of overflowing.
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private final long maxBackoffMs;

    public ExponentialBackoffPolicy(long maxBackoffMs) {
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
        var shift = Math.min(Math.max(attempt, 1) - 1, 62);
        if (baseMs > (Long.MAX_VALUE >> shift)) {
            return maxBackoffMs;
        }
        return Math.min(baseMs << shift, maxBackoffMs);
    }
}
