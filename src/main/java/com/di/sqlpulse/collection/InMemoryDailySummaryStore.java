package com.di.sqlpulse.collection;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of DailySummaryStore. Enforces the (connection, day) uniqueness the
 * JDBC table has, so callers see the same duplicate-key behavior.
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryDailySummaryStore implements DailySummaryStore {

    private final Map<String, DailySummary> summaries = new ConcurrentHashMap<>();

    @Override
    public Optional<DailySummary> find(String connectionId, LocalDate date) {
        return Optional.ofNullable(summaries.get(key(connectionId, date)));
    }

    @Override
    public void insert(DailySummary summary) {
        DailySummary previous = summaries.putIfAbsent(key(summary.getConnectionId(), summary.getSummaryDate()), summary);
        if (previous != null) {
            throw new DuplicateKeyException("Daily summary already exists for "
                    + summary.getConnectionId() + " on " + summary.getSummaryDate());
        }
    }

    @Override
    public void update(DailySummary summary) {
        summaries.put(key(summary.getConnectionId(), summary.getSummaryDate()), summary);
    }

    @Override
    public List<DailySummary> findRange(String connectionId, LocalDate from, LocalDate to) {
        return summaries.values().stream()
                .filter(s -> s.getConnectionId().equals(connectionId))
                .filter(s -> !s.getSummaryDate().isBefore(from) && !s.getSummaryDate().isAfter(to))
                .sorted(Comparator.comparing(DailySummary::getSummaryDate))
                .collect(Collectors.toList());
    }

    @Override
    public int deleteBefore(String connectionId, LocalDate cutoff) {
        int before = summaries.size();
        summaries.values().removeIf(s -> s.getConnectionId().equals(connectionId) && s.getSummaryDate().isBefore(cutoff));
        return before - summaries.size();
    }

    private static String key(String connectionId, LocalDate date) {
        return connectionId + "|" + date;
    }
}
