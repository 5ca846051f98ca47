package io.marketminer.internal.memory;

import io.marketminer.core.DispatchQueue;
import io.marketminer.core.DispatchRequest;
import io.marketminer.core.RetryPolicy;
import io.marketminer.spi.DispatchQueueService;
import io.marketminer.spi.QueueAlreadyExistsException;
import io.marketminer.spi.QueueNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process work channel standing in for a managed task queue.
 *
 * <p>Queue creation is atomic per name. Accepted requests wait in FIFO order until {@link #poll(String)}.
 * Retry policies are recorded but not executed.
 */
public class InMemoryDispatchQueueService implements DispatchQueueService {

    private final ConcurrentMap<String, DispatchQueue> queues = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrentLinkedQueue<DispatchRequest>> pending = new ConcurrentHashMap<>();

    @Override
    public DispatchQueue getQueue(String queueName) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        DispatchQueue queue = queues.get(queueName);
        if (queue == null) {
            throw new QueueNotFoundException(queueName);
        }
        return queue;
    }

    @Override
    public void createQueue(String queueName, RetryPolicy retryPolicy) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        DispatchQueue created = new DispatchQueue(queueName, retryPolicy, Instant.now());
        if (queues.putIfAbsent(queueName, created) != null) {
            throw new QueueAlreadyExistsException(queueName);
        }
        pending.putIfAbsent(queueName, new ConcurrentLinkedQueue<>());
    }

    @Override
    public void enqueue(String queueName, DispatchRequest request) {
        Objects.requireNonNull(queueName, "queueName must not be null");
        Objects.requireNonNull(request, "request must not be null");
        if (!queues.containsKey(queueName)) {
            throw new QueueNotFoundException(queueName);
        }
        pending.computeIfAbsent(queueName, n -> new ConcurrentLinkedQueue<>()).add(request);
    }

    /**
     * Take the oldest pending request, as a worker would.
     */
    public Optional<DispatchRequest> poll(String queueName) {
        ConcurrentLinkedQueue<DispatchRequest> q = pending.get(queueName);
        return q == null ? Optional.empty() : Optional.ofNullable(q.poll());
    }

    public List<DispatchRequest> pending(String queueName) {
        ConcurrentLinkedQueue<DispatchRequest> q = pending.get(queueName);
        return q == null ? List.of() : List.copyOf(q);
    }

    public Set<String> queueNames() {
        return Set.copyOf(queues.keySet());
    }
}
