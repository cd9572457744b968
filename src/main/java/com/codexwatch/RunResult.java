package com.codexwatch;

/**
 * What a pipeline run reports back. Runs never throw; every failure ends up
 * here.
 */
public record RunResult(
        Outcome outcome,
        int deliveredCount,
        String message
) {

    public enum Outcome {
        DRY_RUN,
        NO_UPDATES,
        BOOTSTRAPPED,
        DELIVERED,
        PARTIAL,
        FAILED
    }

    public boolean success() {
        return outcome != Outcome.PARTIAL && outcome != Outcome.FAILED;
    }

    static RunResult failure(int deliveredCount, String message) {
        return new RunResult(deliveredCount > 0 ? Outcome.PARTIAL : Outcome.FAILED, deliveredCount, message);
    }
}
