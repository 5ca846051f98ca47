package io.marketminer.core;

import java.time.Instant;

/**
 * Metadata of an existing dispatch queue as reported by the queue service.
 */
public record DispatchQueue(
        String name,
        RetryPolicy retryPolicy,
        Instant createdAt
) {
}
