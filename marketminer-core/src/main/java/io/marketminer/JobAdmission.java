package io.marketminer;

import io.marketminer.core.Job;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for admitting scrape jobs.
 *
 * <p>Creating a job is a saga across two independent systems:
 * <ul>
 *   <li>persist the job record with status {@code QUEUED}</li>
 *   <li>ensure the domain's dispatch queue exists</li>
 *   <li>enqueue one dispatch request for the worker</li>
 * </ul>
 * If either dispatch step fails, the job record is deleted before the error reaches the caller.
 *
 * <p>Typical usage:
 * <pre>{@code
 * String jobId = admission.createJob("shop.example", List.of("https://shop.example/a"));
 * Optional<Job> job = admission.getJob(jobId);
 * }</pre>
 */
public interface JobAdmission {

    /**
     * Validate, persist and dispatch a new job.
     *
     * @return the generated job id, returned only after the dispatch was accepted
     * @throws io.marketminer.core.JobValidationException  malformed input, nothing was written
     * @throws io.marketminer.core.JobPersistenceException the record store rejected the write
     * @throws io.marketminer.core.JobDispatchException    provisioning or submission failed, record compensated
     */
    String createJob(String domain, List<String> urls);

    /**
     * Read a job straight from the record store. Never cached.
     *
     * @throws io.marketminer.core.JobPersistenceException the record store could not be read
     */
    Optional<Job> getJob(String jobId);
}
