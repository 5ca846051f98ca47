package io.marketminer.core;

import java.util.List;

/**
 * Input was rejected before anything was persisted.
 */
public class JobValidationException extends JobAdmissionException {

    private final List<String> errors;

    public JobValidationException(List<String> errors) {
        super("Invalid job request: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
