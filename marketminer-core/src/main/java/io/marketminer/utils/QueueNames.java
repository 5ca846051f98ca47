package io.marketminer.utils;

import java.util.Objects;

/**
 * Deterministic mapping from domain to dispatch queue name.
 */
public final class QueueNames {

    public static final String DEFAULT_PREFIX = "prices-";

    private final String prefix;

    public QueueNames(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
    }

    public QueueNames() {
        this(DEFAULT_PREFIX);
    }

    public String forDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        return prefix + domain;
    }

    public String prefix() {
        return prefix;
    }
}
