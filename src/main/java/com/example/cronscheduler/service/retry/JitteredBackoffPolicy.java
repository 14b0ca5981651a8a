package com.example.cronscheduler.service.retry;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Equal jitter over the capped exponential delay: uniform in {@code [exp/2, exp]}.
 * Spreads retries of jobs that failed together without ever exceeding the ceiling.
 */
public class JitteredBackoffPolicy implements BackoffPolicy {

    private final ExponentialBackoffPolicy exponential;
    private final Supplier<Random> random;

    public JitteredBackoffPolicy(long maxBackoffMs) {
        this(maxBackoffMs, ThreadLocalRandom::current);
    }

    JitteredBackoffPolicy(long maxBackoffMs, Supplier<Random> random) {
        this.exponential = new ExponentialBackoffPolicy(maxBackoffMs);
        this.random = random;
    }

    @Override
    public long delayMs(int attempt, long baseMs) {
        var ceiling = exponential.delayMs(attempt, baseMs);
        if (ceiling <= 1) {
            return ceiling;
        }
        var floor = ceiling / 2;
        // nextLong(bound) is exclusive, so + 1 includes the ceiling
        return floor + random.get().nextLong(ceiling - floor + 1);
    }
}
