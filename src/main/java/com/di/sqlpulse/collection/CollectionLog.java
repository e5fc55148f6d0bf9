package com.di.sqlpulse.collection;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Audit entry for one collection run.
 */
@Value
@Builder(toBuilder = true)
public class CollectionLog {
    String id;
    String connectionId;
    CollectionStatus status;
    String source;
    Instant startedAt;
    Instant completedAt;
    Long durationMs;
    int rowsCollected;
    int rowsInserted;
    String errorMessage;
    String errorDetail;

    public static CollectionLog started(String id, String connectionId, String source, Instant startedAt) {
        return CollectionLog.builder()
                .id(id)
                .connectionId(connectionId)
                .status(CollectionStatus.RUNNING)
                .source(source)
                .startedAt(startedAt)
                .build();
    }

    /**
     * Finalized copy of this log. A completion time before the start (clock step) is clamped to the start.
     */
    public CollectionLog complete(CollectionStatus finalStatus, Instant completedAt, int collected, int inserted,
                                  String errorMessage, String errorDetail) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Collection log " + id + " is already " + status);
        }
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Final status must be terminal: " + finalStatus);
        }
        Instant end = completedAt.isBefore(startedAt) ? startedAt : completedAt;
        return toBuilder()
                .status(finalStatus)
                .completedAt(end)
                .durationMs(Duration.between(startedAt, end).toMillis())
                .rowsCollected(collected)
                .rowsInserted(inserted)
                .errorMessage(errorMessage)
                .errorDetail(errorDetail)
                .build();
    }
}
