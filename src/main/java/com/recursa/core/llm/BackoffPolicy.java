package com.recursa.core.llm;

import com.recursa.core.config.RuntimeProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for transient model errors.
 *
 * @param maxAttempts    total attempts, including the first
 * @param initialBackoff delay before the second attempt
 * @param multiplier     growth factor per attempt
 * @param maxBackoff     upper bound of a single delay
 */
public record BackoffPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double multiplier,
    Duration maxBackoff
) {

    public BackoffPolicy {
        maxAttempts = Math.max(1, maxAttempts);
    }

    public static BackoffPolicy from(RuntimeProperties.ModelRetry retry) {
        return new BackoffPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(),
                retry.getMultiplier(), retry.getMaxBackoff());
    }

    /**
     * Delay after the given failed attempt (1-based), jitter included, capped at {@link #maxBackoff}.
     */
    public long delayMillis(int failedAttempt) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        long cap = maxBackoff.toMillis();
        long capped = (long) Math.min(cap, base);
        long jitterBound = Math.max(1, capped / 10);
        long jitter = ThreadLocalRandom.current().nextLong(0, jitterBound);
        return Math.min(cap, capped + jitter);
    }
}
