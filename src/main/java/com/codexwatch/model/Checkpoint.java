package com.codexwatch.model;

import java.util.Objects;

/**
 * Persisted processing state: one lane per item kind. The lanes never
 * interact.
 */
public record Checkpoint(
        LaneState pullRequests,
        LaneState releases
) {

    public Checkpoint {
        Objects.requireNonNull(pullRequests, "pullRequests must not be null");
        Objects.requireNonNull(releases, "releases must not be null");
    }

    /**
     * State before the first successful run.
     */
    public static Checkpoint empty() {
        return new Checkpoint(LaneState.empty(), LaneState.empty());
    }

    public LaneState lane(LaneKind kind) {
        return kind == LaneKind.PULL_REQUESTS ? pullRequests : releases;
    }

    public Checkpoint withLane(LaneKind kind, LaneState state) {
        return kind == LaneKind.PULL_REQUESTS
                ? new Checkpoint(state, releases)
                : new Checkpoint(pullRequests, state);
    }
}
