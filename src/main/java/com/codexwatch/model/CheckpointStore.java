package com.codexwatch.model;

public interface CheckpointStore {

    /**
     * Load the persisted checkpoint.
     * If none exists yet, return {@link Checkpoint#empty()}.
     */
    Checkpoint load();

    /**
     * Persist the checkpoint, replacing the previous one as a whole.
     */
    void save(Checkpoint checkpoint);
}
