package com.codexwatch;

import com.codexwatch.model.Item;
import com.codexwatch.model.LaneKind;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One independently checkpointed stream of items: the lane it writes to, the
 * batch fetched for this run and how an item becomes a message.
 */
final class Lane<T extends Item> {

    private final LaneKind kind;
    private final List<T> batch;
    private final Function<T, String> renderer;

    Lane(LaneKind kind, List<T> batch, Function<T, String> renderer) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.batch = List.copyOf(batch);
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    LaneKind kind() {
        return kind;
    }

    List<T> batch() {
        return batch;
    }

    String render(T item) {
        return renderer.apply(item);
    }
}
