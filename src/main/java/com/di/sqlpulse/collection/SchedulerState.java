package com.di.sqlpulse.collection;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Snapshot of one connection's collection timer. */
@Value
@Builder(toBuilder = true)
public class SchedulerState {
    String connectionId;
    boolean running;
    int intervalMinutes;
    Instant lastCollection;
    Instant nextCollection;
    long collectionsCount;
    long errorCount;
    long skippedCount;
    String lastError;

    public static SchedulerState idle(String connectionId) {
        return SchedulerState.builder().connectionId(connectionId).build();
    }
}
