package io.marketminer.config;

import io.marketminer.internal.mongo.DispatchTaskDocument;
import io.marketminer.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for job records and dispatch tasks.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code marketminer.ensure-indexes-on-startup=true}.
 * Queue uniqueness needs no extra index: the queue name is the {@code _id} of {@code dispatch_queues}.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_status_createdAt</b> on {@code jobs}: { status: 1, createdAt: 1 }
 *       <br/>Used by the stale-job sweep.</li>
 *   <li><b>idx_queue_state_scheduleAt</b> on {@code dispatch_tasks}: { queueName: 1, state: 1, scheduleAt: 1 }
 *       <br/>Used when reading pending tasks of a queue.</li>
 *   <li><b>idx_jobId</b> on {@code dispatch_tasks}: { jobId: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ status: 1, createdAt: 1 }, { name: "idx_status_createdAt" });
 * db.dispatch_tasks.createIndex({ queueName: 1, state: 1, scheduleAt: 1 }, { name: "idx_queue_state_scheduleAt" });
 * db.dispatch_tasks.createIndex({ jobId: 1 }, { name: "idx_jobId" });
 * </pre>
 */
public class MarketMinerMongoIndexConfig {

    public static final String IDX_STATUS_CREATED_AT = "idx_status_createdAt";
    public static final String IDX_QUEUE_STATE_SCHEDULE_AT = "idx_queue_state_scheduleAt";
    public static final String IDX_JOB_ID = "idx_jobId";

    private final MongoTemplate mongoTemplate;

    public MarketMinerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(statusCreatedAtIndex());
        mongoTemplate.indexOps(DispatchTaskDocument.class).ensureIndex(queueStateScheduleIndex());
        mongoTemplate.indexOps(DispatchTaskDocument.class).ensureIndex(jobIdIndex());
    }

    public static Index statusCreatedAtIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_STATUS_CREATED_AT);
    }

    public static Index queueStateScheduleIndex() {
        return new Index()
                .on("queueName", Sort.Direction.ASC)
                .on("state", Sort.Direction.ASC)
                .on("scheduleAt", Sort.Direction.ASC)
                .named(IDX_QUEUE_STATE_SCHEDULE_AT);
    }

    public static Index jobIdIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .named(IDX_JOB_ID);
    }
}
