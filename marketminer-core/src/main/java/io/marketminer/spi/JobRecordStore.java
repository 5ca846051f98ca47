package io.marketminer.spi;

import io.marketminer.core.Job;

import java.util.Optional;

/**
 * Durable key-value store for job records, keyed by job id.
 *
 * <p>Implementations signal unavailability or rejection with an unchecked exception.
 */
public interface JobRecordStore {

    /**
     * Write the record under {@code job.id()}, replacing any existing one.
     */
    void put(Job job);

    Optional<Job> get(String jobId);

    /**
     * Delete the record. Deleting a missing id is not an error.
     */
    void delete(String jobId);
}
