package com.codexwatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A published, non-draft release.
 */
public record Release(
        long id,
        String tagName,
        String name,
        String htmlUrl,
        Instant publishedAt,
        String body,
        boolean prerelease
) implements Item {

    public Release {
        Objects.requireNonNull(publishedAt, "publishedAt must not be null");
    }

    @Override
    public String title() {
        return name;
    }

    @Override
    public String url() {
        return htmlUrl;
    }

    @Override
    public Instant timestamp() {
        return publishedAt;
    }
}
