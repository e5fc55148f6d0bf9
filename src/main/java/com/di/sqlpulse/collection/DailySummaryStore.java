package com.di.sqlpulse.collection;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * One summary per (connection, day).
 */
public interface DailySummaryStore {

    Optional<DailySummary> find(String connectionId, LocalDate date);

    /**
     * @throws org.springframework.dao.DuplicateKeyException if a summary for the day already exists
     */
    void insert(DailySummary summary);

    void update(DailySummary summary);

    /** Days {@code from..to} inclusive, oldest first. */
    List<DailySummary> findRange(String connectionId, LocalDate from, LocalDate to);

    int deleteBefore(String connectionId, LocalDate cutoff);
}
