package com.codexwatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A merged pull request as listed by GitHub.
 */
public record PullRequest(
        long id,
        int number,
        String title,
        String htmlUrl,
        Instant mergedAt
) implements Item {

    public PullRequest {
        Objects.requireNonNull(mergedAt, "mergedAt must not be null");
    }

    @Override
    public String url() {
        return htmlUrl;
    }

    @Override
    public Instant timestamp() {
        return mergedAt;
    }
}
