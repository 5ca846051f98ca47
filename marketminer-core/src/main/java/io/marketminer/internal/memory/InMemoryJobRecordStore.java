package io.marketminer.internal.memory;

import io.marketminer.core.Job;
import io.marketminer.core.JobStatus;
import io.marketminer.spi.JobRecordStore;
import io.marketminer.spi.QueuedJobSweeper;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Embedded record store for tests and local runs. Nothing survives the process.
 */
public class InMemoryJobRecordStore implements JobRecordStore, QueuedJobSweeper {

    private final ConcurrentMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void put(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<Job> get(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public void delete(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        jobs.remove(jobId);
    }

    @Override
    public List<Job> findQueuedCreatedBefore(Instant cutoff, int limit) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.QUEUED)
                .filter(j -> j.createdAt() != null && j.createdAt().isBefore(cutoff))
                .sorted(Comparator.comparing(Job::createdAt))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public boolean failIfStillQueued(String jobId, Instant now) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(now, "now must not be null");
        boolean[] changed = {false};
        jobs.computeIfPresent(jobId, (id, job) -> {
            if (job.status() != JobStatus.QUEUED) {
                return job;
            }
            changed[0] = true;
            return new Job(job.id(), job.domain(), job.urls(), JobStatus.FAILED, job.createdAt(), now);
        });
        return changed[0];
    }

    public int size() {
        return jobs.size();
    }
}
