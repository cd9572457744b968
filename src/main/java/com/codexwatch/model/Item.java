package com.codexwatch.model;

import java.time.Instant;

/**
 * Fields every notifiable item exposes, whatever its kind.
 */
public interface Item {

    /**
     * Unique within the item kind and stable across fetches.
     */
    long id();

    String title();

    String url();

    /**
     * Merge time or publish time, in UTC.
     */
    Instant timestamp();
}
