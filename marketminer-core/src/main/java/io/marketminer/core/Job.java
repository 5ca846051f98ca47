package io.marketminer.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted scrape job.
 */
public record Job(

        // identity
        String id,
        String domain,

        // payload
        List<String> urls,

        // state (worker-owned after creation)
        JobStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(status, "status must not be null");
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    /**
     * A freshly admitted job: status {@code QUEUED}, both timestamps set to {@code now}.
     */
    public static Job queued(String id, String domain, List<String> urls, Instant now) {
        return new Job(id, domain, urls, JobStatus.QUEUED, now, now);
    }
}
