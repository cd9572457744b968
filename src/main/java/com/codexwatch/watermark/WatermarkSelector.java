package com.codexwatch.watermark;

import com.codexwatch.model.Item;
import com.codexwatch.model.LaneState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the items of a fetched batch that have not been delivered yet.
 */
public final class WatermarkSelector {

    /**
     * Delivery order: oldest first, lower id first among equal timestamps.
     */
    public static final Comparator<Item> DELIVERY_ORDER =
            Comparator.comparing(Item::timestamp).thenComparingLong(Item::id);

    private WatermarkSelector() {
        // utility class
    }

    /**
     * Returns the unseen items of {@code items} in delivery order.
     *
     * <p>Duplicate ids are collapsed before filtering. The batch is stably
     * sorted in delivery order and the first occurrence of each id is kept,
     * so the earliest timestamp wins and, among equal timestamps, the
     * occurrence that came first in the input.
     */
    public static <T extends Item> List<T> selectUnseen(Collection<T> items, LaneState lane) {
        return selectUnseen(items, lane.watermark(), lane.seenIds());
    }

    public static <T extends Item> List<T> selectUnseen(
            Collection<T> items,
            Instant watermark,
            Set<Long> seenIds
    ) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(DELIVERY_ORDER);

        List<T> selected = new ArrayList<>();
        Set<Long> encountered = new HashSet<>();

        for (T item : sorted) {
            if (!encountered.add(item.id())) {
                continue;
            }
            if (isUnseen(item, watermark, seenIds)) {
                selected.add(item);
            }
        }
        return selected;
    }

    static boolean isUnseen(Item item, Instant watermark, Set<Long> seenIds) {
        if (watermark == null) {
            return true;
        }
        int cmp = item.timestamp().compareTo(watermark);
        if (cmp < 0) {
            return false;
        }
        if (cmp == 0) {
            return !seenIds.contains(item.id());
        }
        return true;
    }
}
