package com.codexwatch.model;

/**
 * The independently tracked checkpoint lanes, with the field names they use
 * in the persisted record.
 */
public enum LaneKind {

    PULL_REQUESTS("last_merged_at", "processed_pr_ids"),
    RELEASES("last_release_published_at", "processed_release_ids");

    private final String watermarkField;
    private final String seenIdsField;

    LaneKind(String watermarkField, String seenIdsField) {
        this.watermarkField = watermarkField;
        this.seenIdsField = seenIdsField;
    }

    public String watermarkField() {
        return watermarkField;
    }

    public String seenIdsField() {
        return seenIdsField;
    }
}
