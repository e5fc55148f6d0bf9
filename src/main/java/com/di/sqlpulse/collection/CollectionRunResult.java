package com.di.sqlpulse.collection;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one collection trigger. A skipped trigger has no log and no status.
 */
@Value
@Builder
public class CollectionRunResult {
    boolean success;
    boolean skipped;
    String connectionId;
    CollectionStatus status;
    String message;
    int rowsCollected;
    int rowsInserted;
    long durationMs;
    String logId;
    @Builder.Default
    List<String> errors = List.of();

    public static CollectionRunResult skipped(String connectionId, String message) {
        return CollectionRunResult.builder()
                .success(false)
                .skipped(true)
                .connectionId(connectionId)
                .message(message)
                .build();
    }
}
