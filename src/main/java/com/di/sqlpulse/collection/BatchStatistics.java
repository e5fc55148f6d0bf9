package com.di.sqlpulse.collection;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * Figures of one persisted batch that feed the daily summary.
 *
 * @param hour local hour the batch was collected in (peak-hour tracking)
 */
public record BatchStatistics(long distinctStatements, long totalExecutions, double avgElapsedTimeMs,
                              double avgCpuTimeMs, double avgBufferGets, double avgDiskReads,
                              double maxElapsedTimeMs, long maxBufferGets, GradeHistogram grades,
                              int hour, Instant collectedAt) {

    public static BatchStatistics of(Collection<PerformanceRecord> records) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("Batch statistics need at least one record");
        }
        PerformanceRecord first = records.iterator().next();
        long distinct = records.stream().map(PerformanceRecord::getSqlId).filter(Objects::nonNull).distinct().count();
        return new BatchStatistics(
                distinct,
                records.stream().mapToLong(PerformanceRecord::getExecutions).sum(),
                records.stream().mapToDouble(PerformanceRecord::getAvgElapsedTimeMs).average().orElse(0),
                records.stream().mapToDouble(PerformanceRecord::getAvgCpuTimeMs).average().orElse(0),
                records.stream().mapToDouble(PerformanceRecord::getAvgBufferGets).average().orElse(0),
                records.stream().mapToDouble(PerformanceRecord::getAvgDiskReads).average().orElse(0),
                records.stream().mapToDouble(PerformanceRecord::getAvgElapsedTimeMs).max().orElse(0),
                records.stream().mapToLong(PerformanceRecord::getAvgBufferGets).max().orElse(0),
                GradeHistogram.of(records),
                first.getCollectionHour(),
                first.getCollectedAt().toInstant());
    }
}
