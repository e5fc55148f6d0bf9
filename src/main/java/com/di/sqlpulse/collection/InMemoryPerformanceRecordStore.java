package com.di.sqlpulse.collection;

import com.di.sqlpulse.history.SortKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory implementation of PerformanceRecordStore. Suitable for single-node and testing.
 * When sqlpulse.storage.persistence-enabled=true, JdbcPerformanceRecordStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryPerformanceRecordStore implements PerformanceRecordStore {

    private final List<PerformanceRecord> records = new ArrayList<>();

    @Override
    public void insertBatch(List<PerformanceRecord> batch) {
        synchronized (records) {
            records.addAll(batch);
        }
    }

    @Override
    public void insert(PerformanceRecord record) {
        synchronized (records) {
            records.add(record);
        }
    }

    @Override
    public List<PerformanceRecord> findByDate(String connectionId, LocalDate date, Integer startHour, Integer endHour,
                                              SortKey sortKey, int limit) {
        List<PerformanceRecord> matching;
        synchronized (records) {
            matching = records.stream()
                    .filter(r -> r.getConnectionId().equals(connectionId))
                    .filter(r -> r.getCollectionDate().equals(date))
                    .filter(r -> startHour == null || r.getCollectionHour() >= startHour)
                    .filter(r -> endHour == null || r.getCollectionHour() <= endHour)
                    .collect(Collectors.toList());
        }
        matching.sort(Comparator.comparingDouble((PerformanceRecord r) -> sortKey.metricOf(r)).reversed());
        return matching.stream().limit(Math.max(1, limit)).collect(Collectors.toList());
    }

    @Override
    public long countByConnection(String connectionId) {
        synchronized (records) {
            return records.stream().filter(r -> r.getConnectionId().equals(connectionId)).count();
        }
    }

    @Override
    public int deleteCollectedBefore(String connectionId, LocalDate cutoff) {
        synchronized (records) {
            int before = records.size();
            records.removeIf(r -> r.getConnectionId().equals(connectionId) && r.getCollectionDate().isBefore(cutoff));
            return before - records.size();
        }
    }
}
