package io.marketminer.core;

/**
 * Base type for every failure reported by {@link io.marketminer.JobAdmission}.
 */
public abstract class JobAdmissionException extends RuntimeException {

    protected JobAdmissionException(String message) {
        super(message);
    }

    protected JobAdmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
