package io.marketminer.api;

public record CreateJobResponse(String jobId) {
}
