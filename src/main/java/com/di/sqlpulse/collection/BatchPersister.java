package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import com.di.sqlpulse.util.TelemetryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes records in chunks of {@code sqlpulse.collection.batch-size}. A chunk that fails is
 * retried one record at a time so a single bad record costs only itself.
 */
@Slf4j
@Component
public class BatchPersister {

    private final PerformanceRecordStore store;
    private final TelemetryMetrics metrics;
    private final int batchSize;

    public BatchPersister(PerformanceRecordStore store, CollectionProperties properties, TelemetryMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
        this.batchSize = Math.max(1, properties.getBatchSize());
    }

    public PersistOutcome persist(List<PerformanceRecord> records) {
        List<PerformanceRecord> inserted = new ArrayList<>(records.size());
        List<RecordError> errors = new ArrayList<>();
        int failedBatches = 0;

        for (int from = 0; from < records.size(); from += batchSize) {
            List<PerformanceRecord> chunk = records.subList(from, Math.min(from + batchSize, records.size()));
            try {
                store.insertBatch(chunk);
                inserted.addAll(chunk);
            } catch (RuntimeException batchFailure) {
                failedBatches++;
                log.warn("[PERSIST] Batch of {} records failed ({}); retrying record by record",
                        chunk.size(), batchFailure.getMessage());
                insertIndividually(chunk, inserted, errors);
            }
        }

        metrics.recordRecordFailures(errors.size());
        if (!errors.isEmpty()) {
            log.warn("[PERSIST] {} inserted, {} rejected across {} failed batch(es)",
                    inserted.size(), errors.size(), failedBatches);
        }
        return new PersistOutcome(inserted, errors, failedBatches);
    }

    private void insertIndividually(List<PerformanceRecord> chunk, List<PerformanceRecord> inserted,
                                    List<RecordError> errors) {
        for (PerformanceRecord record : chunk) {
            try {
                store.insert(record);
                inserted.add(record);
            } catch (RuntimeException e) {
                log.debug("[PERSIST] Record rejected: sqlId={} | {}", record.getSqlId(), e.getMessage());
                errors.add(new RecordError(record.getSqlId(), e.getMessage()));
            }
        }
    }
}
