package io.marketminer.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for an accepted dispatch waiting to be delivered to the worker.
 */
@Document(collection = "dispatch_tasks")
public class DispatchTaskDocument {

    public static final String STATE_PENDING = "PENDING";

    @Id
    private String id;

    private String queueName;
    private String jobId;
    private String httpMethod;
    private String targetUri;
    private Map<String, String> headers;
    private String body;
    private String invokerIdentity;

    private String state;
    private int attempts;
    private Instant enqueuedAt;
    private Instant scheduleAt;

    public DispatchTaskDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getHttpMethod() {
        return httpMethod;
    }

    public void setHttpMethod(String httpMethod) {
        this.httpMethod = httpMethod;
    }

    public String getTargetUri() {
        return targetUri;
    }

    public void setTargetUri(String targetUri) {
        this.targetUri = targetUri;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getInvokerIdentity() {
        return invokerIdentity;
    }

    public void setInvokerIdentity(String invokerIdentity) {
        this.invokerIdentity = invokerIdentity;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }

    public Instant getScheduleAt() {
        return scheduleAt;
    }

    public void setScheduleAt(Instant scheduleAt) {
        this.scheduleAt = scheduleAt;
    }
}
