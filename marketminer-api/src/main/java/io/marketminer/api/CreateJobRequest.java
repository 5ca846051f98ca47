package io.marketminer.api;

import java.util.List;

public record CreateJobRequest(String domain, List<String> urls) {
}
