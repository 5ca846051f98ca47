package io.marketminer.core;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * One enqueue operation: an HTTP invocation of the worker, executed by the queue service.
 *
 * <p>{@code invokerIdentity} names the execution identity the queue service authenticates as.
 * It is a reference, never a secret.
 */
public record DispatchRequest(
        String jobId,
        String httpMethod,
        URI targetUri,
        Map<String, String> headers,
        String body,
        String invokerIdentity
) {
    public DispatchRequest {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(httpMethod, "httpMethod must not be null");
        Objects.requireNonNull(targetUri, "targetUri must not be null");
        Objects.requireNonNull(invokerIdentity, "invokerIdentity must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
