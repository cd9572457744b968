package com.codexwatch.watermark;

import com.codexwatch.model.Item;
import com.codexwatch.model.LaneState;

import java.util.Collection;
import java.util.Optional;

/**
 * First-run handling: a lane that has never advanced adopts the newest items
 * of the current batch as its watermark instead of notifying the backlog.
 */
public final class BootstrapPolicy {

    private BootstrapPolicy() {
        // utility class
    }

    public static boolean isPending(LaneState lane) {
        return !lane.hasWatermark() && lane.seenIds().isEmpty();
    }

    /**
     * Lane state that treats the whole batch as delivered, or empty when the
     * batch is empty and bootstrapping has to wait for the next run.
     */
    public static Optional<LaneState> bootstrap(LaneState lane, Collection<? extends Item> batch) {
        if (batch.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CheckpointAdvancer.advance(lane, batch));
    }
}
