package io.marketminer.internal;

import io.marketminer.JobAdmission;
import io.marketminer.core.Job;
import io.marketminer.core.JobDispatchException;
import io.marketminer.core.JobPersistenceException;
import io.marketminer.core.JobValidationException;
import io.marketminer.spi.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Create-job saga: persist, provision, dispatch, and delete the record again if dispatch fails.
 *
 * <p>Holds no mutable state; any number of callers may use one instance concurrently.
 * A crash between persisting and dispatching leaves a {@code QUEUED} record behind; see
 * {@link QueuedJobReconciler}.
 */
public class DefaultJobAdmission implements JobAdmission {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobAdmission.class);

    private final JobRecordStore store;
    private final QueueProvisioner provisioner;
    private final DispatchSubmitter submitter;
    private final BoundaryCalls calls;

    public DefaultJobAdmission(JobRecordStore store, QueueProvisioner provisioner, DispatchSubmitter submitter, BoundaryCalls calls) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner must not be null");
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
    }

    @Override
    public String createJob(String domain, List<String> urls) {
        JobRequestValidator.validate(domain, urls);

        String jobId = UUID.randomUUID().toString();
        Job job = Job.queued(jobId, domain, urls, nowInstant());

        try {
            calls.runOrUndo("store.put", () -> store.put(job), () -> discardLateRecord(jobId));
        } catch (RuntimeException e) {
            log.error("Failed to persist job jobId={} domain={} msg={}", jobId, domain, e.getMessage(), e);
            throw new JobPersistenceException("Failed to persist job " + jobId, e);
        }

        try {
            provisioner.ensureQueue(domain);
            submitter.submit(jobId, domain, job.urls());
        } catch (JobDispatchException e) {
            log.error("Failed to dispatch job jobId={} domain={} msg={}", jobId, domain, e.getMessage(), e);
            compensate(jobId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected dispatch failure jobId={} domain={} msg={}", jobId, domain, e.getMessage(), e);
            compensate(jobId);
            throw new JobDispatchException("Failed to dispatch job " + jobId, e);
        }

        log.info("Created job jobId={} domain={} urls={}", jobId, domain, urls.size());
        return jobId;
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new JobValidationException(List.of("jobId must not be blank"));
        }

        try {
            return calls.call("store.get", () -> store.get(jobId));
        } catch (RuntimeException e) {
            log.error("Failed to retrieve job jobId={} msg={}", jobId, e.getMessage(), e);
            throw new JobPersistenceException("Failed to retrieve job " + jobId, e);
        }
    }

    /**
     * Best effort. A failed delete is logged and never replaces the dispatch error.
     */
    private void compensate(String jobId) {
        try {
            calls.run("store.delete", () -> store.delete(jobId));
            log.info("Removed job record after failed dispatch jobId={}", jobId);
        } catch (RuntimeException e) {
            log.warn("Failed to clean up job record jobId={} after failed dispatch msg={}", jobId, e.getMessage(), e);
        }
    }

    /**
     * Runs after a put that was abandoned at its deadline has finished. The caller was already told the
     * job failed, so the record must not stay visible.
     */
    private void discardLateRecord(String jobId) {
        try {
            store.delete(jobId);
            log.info("Removed job record written after persist timeout jobId={}", jobId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove job record written after persist timeout jobId={} msg={}", jobId, e.getMessage(), e);
        }
    }

    /**
     * Utility: current admission time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }
}
