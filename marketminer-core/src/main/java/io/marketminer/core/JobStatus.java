package io.marketminer.core;

/**
 * Lifecycle of a job.
 *
 * <p>Only {@link #QUEUED} is written by admission. Every later transition belongs to the worker.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
