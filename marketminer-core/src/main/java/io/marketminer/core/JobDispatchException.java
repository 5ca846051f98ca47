package io.marketminer.core;

/**
 * Queue provisioning or dispatch submission failed.
 */
public class JobDispatchException extends JobAdmissionException {

    public JobDispatchException(String message) {
        super(message);
    }

    public JobDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
