package com.di.sqlpulse.collection;

/**
 * Lifecycle of a collection run. A log is created RUNNING and finalized exactly once.
 */
public enum CollectionStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /** SUCCESS without errors; PARTIAL with errors and something inserted; FAILED with errors only. */
    public static CollectionStatus fromOutcome(int inserted, int errors) {
        if (errors == 0) {
            return SUCCESS;
        }
        return inserted > 0 ? PARTIAL : FAILED;
    }
}
