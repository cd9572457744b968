package com.codexwatch.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Progress of one lane.
 *
 * <p>{@code seenIds} only carries meaning for items whose timestamp equals
 * {@code watermark}: anything older is implicitly seen, anything newer is
 * implicitly unseen. A lane without a watermark never holds ids.
 */
public record LaneState(
        Instant watermark,
        SortedSet<Long> seenIds
) {

    private static final LaneState EMPTY = new LaneState(null, Collections.emptySortedSet());

    public LaneState {
        seenIds = Collections.unmodifiableSortedSet(
                new TreeSet<>(seenIds == null ? Collections.emptySortedSet() : seenIds));
        if (watermark == null && !seenIds.isEmpty()) {
            throw new IllegalArgumentException("seenIds must be empty when watermark is absent");
        }
    }

    public static LaneState empty() {
        return EMPTY;
    }

    public static LaneState of(Instant watermark, Collection<Long> seenIds) {
        return new LaneState(watermark, new TreeSet<>(seenIds));
    }

    public boolean hasWatermark() {
        return watermark != null;
    }
}
