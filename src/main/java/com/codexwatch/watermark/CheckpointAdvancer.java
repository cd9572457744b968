package com.codexwatch.watermark;

import com.codexwatch.model.Item;
import com.codexwatch.model.LaneState;

import java.time.Instant;
import java.util.Collection;
import java.util.TreeSet;

/**
 * Computes the lane state that follows a set of delivered items.
 *
 * <p>Several items can share a timestamp, so the lane keeps the ids seen at
 * the watermark instead of the watermark alone. The watermark never moves
 * backwards.
 */
public final class CheckpointAdvancer {

    private CheckpointAdvancer() {
        // utility class
    }

    public static LaneState advance(LaneState current, Collection<? extends Item> delivered) {
        if (delivered.isEmpty()) {
            return current;
        }

        Instant max = current.watermark();
        for (Item item : delivered) {
            if (max == null || item.timestamp().isAfter(max)) {
                max = item.timestamp();
            }
        }

        TreeSet<Long> ids = new TreeSet<>();
        if (max.equals(current.watermark())) {
            ids.addAll(current.seenIds());
        }
        for (Item item : delivered) {
            if (item.timestamp().equals(max)) {
                ids.add(item.id());
            }
        }
        return new LaneState(max, ids);
    }
}
