package io.marketminer.internal;

import io.marketminer.core.JobValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Input checks that must pass before a job record is written.
 */
public final class JobRequestValidator {
    private JobRequestValidator() {
    }

    /**
     * Collects every problem and throws once.
     *
     * @throws JobValidationException when the domain or any URL is unusable
     */
    public static void validate(String domain, List<String> urls) {
        List<String> errors = new ArrayList<>();

        if (domain == null || domain.isBlank()) {
            errors.add("domain must not be blank");
        } else if (domain.chars().anyMatch(Character::isWhitespace)) {
            errors.add("domain must not contain whitespace");
        }

        if (urls == null || urls.isEmpty()) {
            errors.add("urls must contain at least one URL");
        } else {
            for (String url : urls) {
                if (!isAbsoluteUrl(url)) {
                    errors.add("Invalid URL: " + url);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }
    }

    /**
     * True for absolute URIs that name a host, e.g. {@code https://shop.example/a}.
     */
    public static boolean isAbsoluteUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            return uri.isAbsolute() && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
