package io.marketminer.spi;

import io.marketminer.core.DispatchQueue;
import io.marketminer.core.DispatchRequest;
import io.marketminer.core.RetryPolicy;

/**
 * Managed at-least-once task queue with per-queue retry policy.
 */
public interface DispatchQueueService {

    /**
     * @throws QueueNotFoundException when no queue with that name exists
     */
    DispatchQueue getQueue(String queueName);

    /**
     * @throws QueueAlreadyExistsException when the name is already taken
     */
    void createQueue(String queueName, RetryPolicy retryPolicy);

    /**
     * Accept one dispatch onto an existing queue. Returning normally means the service took it.
     */
    void enqueue(String queueName, DispatchRequest request);
}
