package io.marketminer.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.marketminer.core.Job;
import io.marketminer.core.JobStatus;
import io.marketminer.spi.JobRecordStore;
import io.marketminer.spi.QueuedJobSweeper;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for job records ({@code jobs} collection).
 *
 * <p>Records are keyed by job id. {@link #put(Job)} replaces the whole document, so a put for an
 * existing id overwrites it.
 */
public class MongoJobRecordStore implements JobRecordStore, QueuedJobSweeper {

    private final MongoTemplate mongoTemplate;

    public MongoJobRecordStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void put(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        mongoTemplate.save(toDocument(job));
    }

    @Override
    public Optional<Job> get(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        JobDocument doc = mongoTemplate.findById(jobId, JobDocument.class);
        return Optional.ofNullable(doc).map(MongoJobRecordStore::toJob);
    }

    @Override
    public void delete(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        mongoTemplate.remove(new Query(Criteria.where("_id").is(jobId)), JobDocument.class);
    }

    /**
     * Oldest first, at most {@code limit}.
     */
    @Override
    public List<Job> findQueuedCreatedBefore(Instant cutoff, int limit) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("status").is(JobStatus.QUEUED)
                .and("createdAt").lt(cutoff))
                .with(Sort.by(Sort.Direction.ASC, "createdAt"))
                .limit(limit);

        List<Job> out = new ArrayList<>();
        for (JobDocument doc : mongoTemplate.find(q, JobDocument.class)) {
            out.add(toJob(doc));
        }
        return out;
    }

    @Override
    public boolean failIfStillQueued(String jobId, Instant now) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(Criteria.where("_id").is(jobId).and("status").is(JobStatus.QUEUED));
        Update u = new Update()
                .set("status", JobStatus.FAILED)
                .set("updatedAt", now);

        UpdateResult result = mongoTemplate.updateFirst(q, u, JobDocument.class);
        return result.getModifiedCount() > 0;
    }

    static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setDomain(job.domain());
        doc.setUrls(new ArrayList<>(job.urls()));
        doc.setStatus(job.status());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    static Job toJob(JobDocument doc) {
        return new Job(
                doc.getId(),
                doc.getDomain(),
                doc.getUrls() == null ? List.of() : doc.getUrls(),
                doc.getStatus(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
