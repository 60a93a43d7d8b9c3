package com.scanq.retry;

import java.time.Duration;

/**
 * Exponential backoff configuration for {@link RetryExecutor}.
 *
 * @param maxAttempts       total attempts including the first one
 * @param initialDelay      delay after the first failed attempt
 * @param maxDelay          upper bound for any single delay
 * @param backoffMultiplier growth factor applied per attempt
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialDelay, maxDelay, backoffMultiplier);
    }

    /**
     * Delay to wait after the given failed attempt (1-based):
     * {@code min(initialDelay * multiplier^(attempt-1), maxDelay)}.
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double delayMs = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        long capped = (long) Math.min(delayMs, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
