package com.di.sqlpulse.collection;

import com.di.sqlpulse.util.TelemetryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Folds a run's persisted records into the connection's summary for the collection day:
 * seeds the summary on the first run of the day, merges afterwards.
 * Failures are logged and never fail the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyAggregator {

    private final DailySummaryStore store;
    private final TelemetryMetrics metrics;
    private final Clock clock;

    public Optional<DailySummary> aggregate(String connectionId, List<PerformanceRecord> persisted) {
        if (persisted.isEmpty()) {
            return Optional.empty();
        }
        try {
            BatchStatistics batch = BatchStatistics.of(persisted);
            LocalDate date = persisted.get(0).getCollectionDate();
            return Optional.of(upsert(connectionId, date, batch, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[AGGREGATE] Daily summary update failed for {}: {}", connectionId, e.getMessage(), e);
            metrics.recordAggregationFailure();
            return Optional.empty();
        }
    }

    private DailySummary upsert(String connectionId, LocalDate date, BatchStatistics batch, Instant now) {
        Optional<DailySummary> existing = store.find(connectionId, date);
        if (existing.isPresent()) {
            return mergeInto(existing.get(), batch, now);
        }
        DailySummary seeded = DailySummary.seed(connectionId, date, batch, now);
        try {
            store.insert(seeded);
            return seeded;
        } catch (DuplicateKeyException e) {
            // another run seeded the day between our read and insert
            log.debug("[AGGREGATE] Summary for {} on {} created concurrently; merging", connectionId, date);
            DailySummary current = store.find(connectionId, date).orElseThrow(() -> e);
            return mergeInto(current, batch, now);
        }
    }

    private DailySummary mergeInto(DailySummary current, BatchStatistics batch, Instant now) {
        DailySummary merged = current.merge(batch, now);
        store.update(merged);
        return merged;
    }
}
