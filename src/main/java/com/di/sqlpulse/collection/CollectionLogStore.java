package com.di.sqlpulse.collection;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage of collection run logs. Deleting logs never touches collected records.
 */
public interface CollectionLogStore {

    void insert(CollectionLog log);

    /** Writes the terminal state of a log created with {@link #insert}. */
    void complete(CollectionLog log);

    Optional<CollectionLog> findById(String logId);

    /** Newest first. */
    List<CollectionLog> findRecent(String connectionId, int limit);

    boolean deleteById(String connectionId, String logId);

    int deleteByConnection(String connectionId);

    int deleteStartedBefore(Instant cutoff);
}
