package io.marketminer.internal;

import java.time.Duration;

/**
 * A call to the record store or queue service did not finish within its deadline.
 */
public class BoundaryTimeoutException extends RuntimeException {

    private final String operation;

    public BoundaryTimeoutException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
