package io.marketminer.api;

import io.marketminer.core.JobDispatchException;
import io.marketminer.core.JobPersistenceException;
import io.marketminer.core.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.List;
import java.util.Map;

/**
 * Maps admission failures to HTTP responses. Store and queue failures become a generic 503 so
 * dependency details stay in the logs.
 */
@RestControllerAdvice
public class JobApiExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(JobApiExceptionHandler.class);

    static final String UNAVAILABLE_DETAIL = "The job service is temporarily unavailable";

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<Map<String, List<String>>> handleValidation(JobValidationException ex) {
        log.warn("Invalid job request errors={}", ex.getErrors());
        return ResponseEntity.badRequest().body(Map.of("errors", ex.getErrors()));
    }

    @ExceptionHandler({JobPersistenceException.class, JobDispatchException.class})
    public ProblemDetail handleUnavailable(RuntimeException ex) {
        log.error("Service unavailable msg={}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE_DETAIL);
        problem.setTitle("Service Unavailable");
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error msg={}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        return problem;
    }
}
