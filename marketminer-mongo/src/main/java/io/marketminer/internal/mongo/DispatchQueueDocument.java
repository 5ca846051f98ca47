package io.marketminer.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One dispatch queue. The queue name is the document id, so a second insert for the same name
 * fails with a duplicate key.
 */
@Document(collection = "dispatch_queues")
public class DispatchQueueDocument {

    @Id
    private String name;

    private int maxAttempts;
    private long minBackoffMillis;
    private long maxBackoffMillis;
    private long maxRetryDurationMillis;
    private Instant createdAt;

    public DispatchQueueDocument() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getMinBackoffMillis() {
        return minBackoffMillis;
    }

    public void setMinBackoffMillis(long minBackoffMillis) {
        this.minBackoffMillis = minBackoffMillis;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public void setMaxBackoffMillis(long maxBackoffMillis) {
        this.maxBackoffMillis = maxBackoffMillis;
    }

    public long getMaxRetryDurationMillis() {
        return maxRetryDurationMillis;
    }

    public void setMaxRetryDurationMillis(long maxRetryDurationMillis) {
        this.maxRetryDurationMillis = maxRetryDurationMillis;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
