package io.marketminer.internal.mongo;

import io.marketminer.core.DispatchQueue;
import io.marketminer.core.DispatchRequest;
import io.marketminer.core.RetryPolicy;
import io.marketminer.spi.DispatchQueueService;
import io.marketminer.spi.QueueAlreadyExistsException;
import io.marketminer.spi.QueueNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch queues kept in MongoDB.
 *
 * <p>Queue metadata lives in {@code dispatch_queues} with the queue name as {@code _id}. Accepted
 * requests are stored in {@code dispatch_tasks} as {@code PENDING} documents for a delivery process
 * to pick up.
 */
public class MongoDispatchQueueService implements DispatchQueueService {
    private static final Logger log = LoggerFactory.getLogger(MongoDispatchQueueService.class);

    private final MongoTemplate mongoTemplate;

    public MongoDispatchQueueService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public DispatchQueue getQueue(String queueName) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        DispatchQueueDocument doc = mongoTemplate.findById(queueName, DispatchQueueDocument.class);
        if (doc == null) {
            throw new QueueNotFoundException(queueName);
        }
        return toQueue(doc);
    }

    @Override
    public void createQueue(String queueName, RetryPolicy retryPolicy) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");

        DispatchQueueDocument doc = new DispatchQueueDocument();
        doc.setName(queueName);
        doc.setMaxAttempts(retryPolicy.maxAttempts());
        doc.setMinBackoffMillis(retryPolicy.minBackoff().toMillis());
        doc.setMaxBackoffMillis(retryPolicy.maxBackoff().toMillis());
        doc.setMaxRetryDurationMillis(retryPolicy.maxRetryDuration().toMillis());
        doc.setCreatedAt(nowInstant());

        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            throw new QueueAlreadyExistsException(queueName, e);
        }
        log.debug("Dispatch queue stored queue={}", queueName);
    }

    @Override
    public void enqueue(String queueName, DispatchRequest request) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        Objects.requireNonNull(request, "request must not be null");

        if (!mongoTemplate.exists(new Query(Criteria.where("_id").is(queueName)), DispatchQueueDocument.class)) {
            throw new QueueNotFoundException(queueName);
        }

        Instant now = nowInstant();
        DispatchTaskDocument task = new DispatchTaskDocument();
        task.setQueueName(queueName);
        task.setJobId(request.jobId());
        task.setHttpMethod(request.httpMethod());
        task.setTargetUri(request.targetUri().toString());
        task.setHeaders(new HashMap<>(request.headers()));
        task.setBody(request.body());
        task.setInvokerIdentity(request.invokerIdentity());
        task.setState(DispatchTaskDocument.STATE_PENDING);
        task.setAttempts(0);
        task.setEnqueuedAt(now);
        task.setScheduleAt(now);

        mongoTemplate.insert(task);
    }

    /**
     * Pending requests of one queue, oldest first.
     */
    public List<DispatchRequest> pending(String queueName) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        Query q = new Query(Criteria.where("queueName").is(queueName)
                .and("state").is(DispatchTaskDocument.STATE_PENDING))
                .with(Sort.by(Sort.Direction.ASC, "enqueuedAt"));

        List<DispatchRequest> out = new ArrayList<>();
        for (DispatchTaskDocument task : mongoTemplate.find(q, DispatchTaskDocument.class)) {
            out.add(toRequest(task));
        }
        return out;
    }

    protected Instant nowInstant() {
        return Instant.now();
    }

    private static DispatchQueue toQueue(DispatchQueueDocument doc) {
        RetryPolicy policy = new RetryPolicy(
                doc.getMaxAttempts(),
                Duration.ofMillis(doc.getMinBackoffMillis()),
                Duration.ofMillis(doc.getMaxBackoffMillis()),
                Duration.ofMillis(doc.getMaxRetryDurationMillis())
        );
        return new DispatchQueue(doc.getName(), policy, doc.getCreatedAt());
    }

    private static DispatchRequest toRequest(DispatchTaskDocument task) {
        Map<String, String> headers = task.getHeaders() == null ? Map.of() : task.getHeaders();
        return new DispatchRequest(
                task.getJobId(),
                task.getHttpMethod(),
                URI.create(task.getTargetUri()),
                headers,
                task.getBody(),
                task.getInvokerIdentity()
        );
    }
}
