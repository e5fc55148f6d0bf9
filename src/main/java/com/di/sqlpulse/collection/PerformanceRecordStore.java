package com.di.sqlpulse.collection;

import com.di.sqlpulse.history.SortKey;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable storage of collected records. Implementations are in-memory or JDBC
 * (see db/schema-postgres.sql).
 */
public interface PerformanceRecordStore {

    /**
     * Inserts all records or none.
     *
     * @throws org.springframework.dao.DataAccessException if any record is rejected
     */
    void insertBatch(List<PerformanceRecord> records);

    void insert(PerformanceRecord record);

    /**
     * Records of one connection and day, ordered by {@code sortKey} descending.
     *
     * @param startHour first collection hour to include, or null for the whole day
     * @param endHour   last collection hour to include (inclusive), or null for the whole day
     */
    List<PerformanceRecord> findByDate(String connectionId, LocalDate date, Integer startHour, Integer endHour,
                                       SortKey sortKey, int limit);

    long countByConnection(String connectionId);

    /** Deletes records of the connection collected before {@code cutoff} (exclusive). */
    int deleteCollectedBefore(String connectionId, LocalDate cutoff);
}
