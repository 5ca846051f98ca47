package io.marketminer.core;

import java.net.URI;
import java.util.Objects;

/**
 * Where dispatches are sent and which identity invokes the worker.
 */
public record DispatchTarget(URI invocationUri, String invokerIdentity) {

    private static final String RUN_JOB_URI = "https://run.googleapis.com/v2/projects/%s/locations/%s/jobs/%s:run";

    public DispatchTarget {
        Objects.requireNonNull(invocationUri, "invocationUri must not be null");
        if (invokerIdentity == null || invokerIdentity.isBlank()) {
            throw new IllegalArgumentException("invokerIdentity must not be blank");
        }
    }

    /**
     * Target that runs a serverless container job, one execution per dispatch.
     */
    public static DispatchTarget runJob(String project, String region, String workerJob, String invokerIdentity) {
        requireText(project, "project");
        requireText(region, "region");
        requireText(workerJob, "workerJob");
        return new DispatchTarget(
                URI.create(String.format(RUN_JOB_URI, project, region, workerJob)),
                invokerIdentity
        );
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
