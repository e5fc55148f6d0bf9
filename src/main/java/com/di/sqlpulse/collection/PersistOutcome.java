package com.di.sqlpulse.collection;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of persisting one run's records.
 *
 * @param inserted      records actually written, in input order
 * @param errors        one entry per record rejected after its batch failed
 * @param failedBatches batches that had to be retried record by record
 */
public record PersistOutcome(List<PerformanceRecord> inserted, List<RecordError> errors, int failedBatches) {

    private static final int MAX_ERRORS_IN_MESSAGE = 10;

    public PersistOutcome {
        inserted = List.copyOf(inserted);
        errors = List.copyOf(errors);
    }

    public int insertedCount() {
        return inserted.size();
    }

    public CollectionStatus status() {
        return CollectionStatus.fromOutcome(inserted.size(), errors.size());
    }

    /** First few errors joined for the collection log; null when there are none. */
    public String errorSummary() {
        if (errors.isEmpty()) {
            return null;
        }
        String joined = errors.stream()
                .limit(MAX_ERRORS_IN_MESSAGE)
                .map(RecordError::toString)
                .collect(Collectors.joining("; "));
        int more = errors.size() - MAX_ERRORS_IN_MESSAGE;
        return more > 0 ? joined + " (+" + more + " more)" : joined;
    }
}
