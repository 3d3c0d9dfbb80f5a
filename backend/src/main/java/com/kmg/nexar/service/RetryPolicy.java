package com.kmg.nexar.service;

import java.time.Duration;

/**
 * Per-chunk retry budget with exponential backoff.
 *
 * @param maxAttempts total tries per chunk, including the first one
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * Delay before retry number {@code retry} (1-based): base, 2*base, 4*base, ... capped at maxDelay.
     */
    public Duration delayBefore(int retry) {
        int shift = Math.min(Math.max(0, retry - 1), 30);
        long millis = baseDelay.toMillis() << shift;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
