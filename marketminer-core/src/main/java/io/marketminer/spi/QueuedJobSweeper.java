package io.marketminer.spi;

import io.marketminer.core.Job;

import java.time.Instant;
import java.util.List;

/**
 * Optional store capability used to find jobs whose dispatch was lost.
 */
public interface QueuedJobSweeper {

    /**
     * Jobs still {@code QUEUED} that were created strictly before {@code cutoff}, oldest first.
     */
    List<Job> findQueuedCreatedBefore(Instant cutoff, int limit);

    /**
     * Atomically set status {@code FAILED} if, and only if, the job is still {@code QUEUED}.
     *
     * @return true when the record was changed
     */
    boolean failIfStillQueued(String jobId, Instant now);
}
