package io.marketminer.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery retry policy a dispatch queue is created with.
 *
 * maxAttempts      : total delivery attempts, including the first
 * minBackoff       : delay before the first retry
 * maxBackoff       : cap for the exponential delay between retries
 * maxRetryDuration : give up once this much time has passed since the first attempt
 */
public record RetryPolicy(
        int maxAttempts,
        Duration minBackoff,
        Duration maxBackoff,
        Duration maxRetryDuration
) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(
            7,
            Duration.ofSeconds(1),
            Duration.ofMinutes(10),
            Duration.ofHours(1)
    );

    public RetryPolicy {
        Objects.requireNonNull(minBackoff, "minBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        Objects.requireNonNull(maxRetryDuration, "maxRetryDuration must not be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        if (minBackoff.isNegative() || maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= minBackoff <= maxBackoff");
        }
    }
}
