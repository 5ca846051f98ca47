package io.marketminer.api;

import io.marketminer.JobAdmission;
import io.marketminer.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Caller-facing job endpoints. Status codes:
 * <ul>
 *   <li>201 job admitted, {@code Location: /jobs/{id}}</li>
 *   <li>400 invalid request or malformed job id</li>
 *   <li>404 unknown job id</li>
 *   <li>503 record store or dispatch queue unavailable (see {@link JobApiExceptionHandler})</li>
 * </ul>
 */
@RestController
@RequestMapping("/jobs")
public class JobController {
    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobAdmission jobAdmission;

    public JobController(JobAdmission jobAdmission) {
        this.jobAdmission = jobAdmission;
    }

    @PostMapping
    public ResponseEntity<CreateJobResponse> createJob(@RequestBody CreateJobRequest request) {
        String jobId = jobAdmission.createJob(request.domain(), request.urls());
        log.info("Created job jobId={} domain={}", jobId, request.domain());
        return ResponseEntity.created(URI.create("/jobs/" + jobId)).body(new CreateJobResponse(jobId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getJob(@PathVariable("id") String id) {
        if (!isUuid(id)) {
            log.warn("Invalid job ID format jobId={}", id);
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid job ID format"));
        }

        Optional<Job> job = jobAdmission.getJob(id);
        if (job.isEmpty()) {
            log.warn("Job not found jobId={}", id);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Job not found"));
        }
        return ResponseEntity.ok(job.get());
    }

    static boolean isUuid(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
