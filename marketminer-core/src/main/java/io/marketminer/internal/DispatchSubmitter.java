package io.marketminer.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketminer.core.DispatchRequest;
import io.marketminer.core.DispatchTarget;
import io.marketminer.core.JobDispatchException;
import io.marketminer.spi.DispatchQueueService;
import io.marketminer.utils.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the worker invocation for a job and puts it on the domain's queue.
 *
 * <p>The request body asks for one execution of the worker with arguments
 * {@code [domain, "-a", "urls=<json array>"]}:
 * <pre>
 * {"overrides":{"containerOverrides":[{"args":["shop.example","-a","urls=[\"https://shop.example/a\"]"]}],
 *   "taskCount":1,"timeout":"3600s"}}
 * </pre>
 */
public class DispatchSubmitter {
    private static final Logger log = LoggerFactory.getLogger(DispatchSubmitter.class);

    public static final int TASK_COUNT = 1;
    public static final Duration EXECUTION_TIMEOUT = Duration.ofHours(1);

    private final DispatchQueueService queueService;
    private final QueueNames queueNames;
    private final DispatchTarget target;
    private final ObjectMapper objectMapper;
    private final BoundaryCalls calls;

    public DispatchSubmitter(DispatchQueueService queueService, QueueNames queueNames, DispatchTarget target,
                             ObjectMapper objectMapper, BoundaryCalls calls) {
        this.queueService = Objects.requireNonNull(queueService, "queueService must not be null");
        this.queueNames = Objects.requireNonNull(queueNames, "queueNames must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
    }

    /**
     * @throws JobDispatchException when the queue service did not accept the request
     */
    public void submit(String jobId, String domain, List<String> urls) {
        String queueName = queueNames.forDomain(domain);
        DispatchRequest request = buildRequest(jobId, domain, urls);

        try {
            calls.run("queue.enqueue", () -> queueService.enqueue(queueName, request));
        } catch (RuntimeException e) {
            throw new JobDispatchException("Failed to enqueue dispatch for job " + jobId + " on " + queueName, e);
        }
        log.info("Enqueued dispatch jobId={} queue={} urls={}", jobId, queueName, urls.size());
    }

    public DispatchRequest buildRequest(String jobId, String domain, List<String> urls) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(urls, "urls must not be null");

        String body;
        try {
            ObjectNode root = objectMapper.createObjectNode();
            ObjectNode overrides = root.putObject("overrides");
            ArrayNode args = overrides.putArray("containerOverrides")
                    .addObject()
                    .putArray("args");
            args.add(domain);
            args.add("-a");
            args.add("urls=" + objectMapper.writeValueAsString(urls));
            overrides.put("taskCount", TASK_COUNT);
            overrides.put("timeout", EXECUTION_TIMEOUT.toSeconds() + "s");
            body = objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new JobDispatchException("Failed to encode dispatch payload for job " + jobId, e);
        }

        return new DispatchRequest(
                jobId,
                "POST",
                target.invocationUri(),
                Map.of("Content-Type", "application/json"),
                body,
                target.invokerIdentity()
        );
    }
}
