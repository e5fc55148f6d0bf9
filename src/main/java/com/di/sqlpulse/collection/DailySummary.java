package com.di.sqlpulse.collection;

import com.di.sqlpulse.util.PerExecution;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Rollup of one connection's collected records for one day.
 * <p>
 * Merging a batch sums the additive fields, keeps the larger maxima and sets each average to
 * the plain mean of the stored and batch values. The mean is unweighted, so after several runs
 * it leans towards recent batches; readers should treat averages as approximate.
 */
@Value
@Builder(toBuilder = true)
public class DailySummary {
    String connectionId;
    LocalDate summaryDate;
    long totalStatements;
    long totalExecutions;
    double avgElapsedTimeMs;
    double avgCpuTimeMs;
    double avgBufferGets;
    double avgDiskReads;
    double maxElapsedTimeMs;
    long maxBufferGets;
    GradeHistogram grades;
    Integer peakHour;
    long peakHourExecutions;
    int collectionCount;
    Instant firstCollectionAt;
    Instant lastCollectionAt;

    public static DailySummary seed(String connectionId, LocalDate date, BatchStatistics batch, Instant now) {
        return DailySummary.builder()
                .connectionId(connectionId)
                .summaryDate(date)
                .totalStatements(batch.distinctStatements())
                .totalExecutions(batch.totalExecutions())
                .avgElapsedTimeMs(PerExecution.round2(batch.avgElapsedTimeMs()))
                .avgCpuTimeMs(PerExecution.round2(batch.avgCpuTimeMs()))
                .avgBufferGets(PerExecution.round2(batch.avgBufferGets()))
                .avgDiskReads(PerExecution.round2(batch.avgDiskReads()))
                .maxElapsedTimeMs(batch.maxElapsedTimeMs())
                .maxBufferGets(batch.maxBufferGets())
                .grades(batch.grades())
                .peakHour(batch.hour())
                .peakHourExecutions(batch.totalExecutions())
                .collectionCount(1)
                .firstCollectionAt(now)
                .lastCollectionAt(now)
                .build();
    }

    public DailySummary merge(BatchStatistics batch, Instant now) {
        boolean newPeak = peakHour == null || batch.totalExecutions() > peakHourExecutions;
        return toBuilder()
                .totalStatements(totalStatements + batch.distinctStatements())
                .totalExecutions(totalExecutions + batch.totalExecutions())
                .avgElapsedTimeMs(PerExecution.round2((avgElapsedTimeMs + batch.avgElapsedTimeMs()) / 2))
                .avgCpuTimeMs(PerExecution.round2((avgCpuTimeMs + batch.avgCpuTimeMs()) / 2))
                .avgBufferGets(PerExecution.round2((avgBufferGets + batch.avgBufferGets()) / 2))
                .avgDiskReads(PerExecution.round2((avgDiskReads + batch.avgDiskReads()) / 2))
                .maxElapsedTimeMs(Math.max(maxElapsedTimeMs, batch.maxElapsedTimeMs()))
                .maxBufferGets(Math.max(maxBufferGets, batch.maxBufferGets()))
                .grades((grades != null ? grades : GradeHistogram.empty()).plus(batch.grades()))
                .peakHour(newPeak ? Integer.valueOf(batch.hour()) : peakHour)
                .peakHourExecutions(newPeak ? batch.totalExecutions() : peakHourExecutions)
                .collectionCount(collectionCount + 1)
                .firstCollectionAt(firstCollectionAt != null ? firstCollectionAt : now)
                .lastCollectionAt(lastCollectionAt == null || now.isAfter(lastCollectionAt) ? now : lastCollectionAt)
                .build();
    }
}
