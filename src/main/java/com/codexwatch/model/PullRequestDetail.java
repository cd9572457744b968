package com.codexwatch.model;

import java.time.Instant;
import java.util.Objects;

public record PullRequestDetail(
        long id,
        int number,
        String title,
        String htmlUrl,
        Instant mergedAt,
        String body
) implements Item {

    public PullRequestDetail {
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
