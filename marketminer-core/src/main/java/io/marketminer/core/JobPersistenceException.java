package io.marketminer.core;

/**
 * The record store was unavailable or rejected an operation.
 */
public class JobPersistenceException extends JobAdmissionException {

    public JobPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
