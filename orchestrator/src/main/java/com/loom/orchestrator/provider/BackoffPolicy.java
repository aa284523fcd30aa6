package com.loom.orchestrator.provider;

import java.time.Duration;

/**
 * Exponential backoff: the delay before retry {@code n} (1-based) is
 * {@code baseDelay * 2^(n-1)}, never more than {@code maxDelay}.
 */
public record BackoffPolicy(Duration baseDelay, Duration maxDelay) {

    public static final BackoffPolicy NONE = new BackoffPolicy(Duration.ZERO, Duration.ZERO);

    public BackoffPolicy {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay " + maxDelay + " is below baseDelay " + baseDelay);
        }
    }

    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry is 1-based, got " + retry);
        }
        long base = baseDelay.toMillis();
        long max  = maxDelay.toMillis();
        // Shift stays below 63 bits; past that the cap always applies.
        int shift = Math.min(retry - 1, 30);
        long delay = base << shift;
        return Duration.ofMillis(delay < 0 || delay > max ? max : delay);
    }
}
