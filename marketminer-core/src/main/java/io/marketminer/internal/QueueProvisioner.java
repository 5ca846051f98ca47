package io.marketminer.internal;

import io.marketminer.core.JobDispatchException;
import io.marketminer.core.RetryPolicy;
import io.marketminer.spi.DispatchQueueService;
import io.marketminer.spi.QueueAlreadyExistsException;
import io.marketminer.spi.QueueNotFoundException;
import io.marketminer.utils.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Makes sure a domain's dispatch queue exists before anything is enqueued on it.
 *
 * <p>Only an explicit {@link QueueNotFoundException} leads to creation. Any other lookup failure
 * (permission, network, quota) is reported as is. Losing a creation race to another caller is success.
 */
public class QueueProvisioner {
    private static final Logger log = LoggerFactory.getLogger(QueueProvisioner.class);

    private final DispatchQueueService queueService;
    private final QueueNames queueNames;
    private final RetryPolicy retryPolicy;
    private final BoundaryCalls calls;

    public QueueProvisioner(DispatchQueueService queueService, QueueNames queueNames, RetryPolicy retryPolicy, BoundaryCalls calls) {
        this.queueService = Objects.requireNonNull(queueService, "queueService must not be null");
        this.queueNames = Objects.requireNonNull(queueNames, "queueNames must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
    }

    public QueueProvisioner(DispatchQueueService queueService, QueueNames queueNames, BoundaryCalls calls) {
        this(queueService, queueNames, RetryPolicy.DEFAULT, calls);
    }

    /**
     * @throws JobDispatchException when the queue neither exists nor could be created
     */
    public void ensureQueue(String domain) {
        String queueName = queueNames.forDomain(domain);

        try {
            calls.call("queue.get", () -> queueService.getQueue(queueName));
            log.debug("Dispatch queue present queue={}", queueName);
            return;
        } catch (QueueNotFoundException e) {
            log.info("Dispatch queue missing, creating queue={} domain={}", queueName, domain);
        } catch (RuntimeException e) {
            throw new JobDispatchException("Failed to look up dispatch queue " + queueName, e);
        }

        try {
            calls.run("queue.create", () -> queueService.createQueue(queueName, retryPolicy));
            log.info("Created dispatch queue queue={} maxAttempts={} maxRetryDuration={}",
                    queueName, retryPolicy.maxAttempts(), retryPolicy.maxRetryDuration());
        } catch (QueueAlreadyExistsException e) {
            log.debug("Dispatch queue created concurrently queue={}", queueName);
        } catch (RuntimeException e) {
            throw new JobDispatchException("Failed to create dispatch queue " + queueName, e);
        }
    }
}
