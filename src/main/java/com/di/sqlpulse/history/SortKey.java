package com.di.sqlpulse.history;

import com.di.sqlpulse.collection.PerformanceRecord;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Metric a history read is ordered by (descending). Each key knows its stored column and the
 * per-execution expression used in the live-tier queries.
 */
public enum SortKey {

    ELAPSED_TIME(PerformanceRecord::getAvgElapsedTimeMs, HistoryEntry::getAvgElapsedTimeMs,
            "avg_elapsed_time_ms",
            "elapsed_time / DECODE(executions, 0, 1, executions)",
            "SUM(ss.elapsed_time_delta) / DECODE(SUM(ss.executions_delta), 0, 1, SUM(ss.executions_delta))"),
    CPU_TIME(PerformanceRecord::getAvgCpuTimeMs, HistoryEntry::getAvgCpuTimeMs,
            "avg_cpu_time_ms",
            "cpu_time / DECODE(executions, 0, 1, executions)",
            "SUM(ss.cpu_time_delta) / DECODE(SUM(ss.executions_delta), 0, 1, SUM(ss.executions_delta))"),
    BUFFER_GETS(r -> r.getAvgBufferGets(), e -> e.getAvgBufferGets(),
            "avg_buffer_gets",
            "buffer_gets / DECODE(executions, 0, 1, executions)",
            "SUM(ss.buffer_gets_delta) / DECODE(SUM(ss.executions_delta), 0, 1, SUM(ss.executions_delta))"),
    DISK_READS(r -> r.getAvgDiskReads(), e -> e.getAvgDiskReads(),
            "avg_disk_reads",
            "disk_reads / DECODE(executions, 0, 1, executions)",
            "SUM(ss.disk_reads_delta) / DECODE(SUM(ss.executions_delta), 0, 1, SUM(ss.executions_delta))"),
    EXECUTIONS(r -> r.getExecutions(), e -> e.getExecutions(),
            "executions",
            "executions",
            "SUM(ss.executions_delta)");

    private final ToDoubleFunction<PerformanceRecord> recordMetric;
    private final ToDoubleFunction<HistoryEntry> entryMetric;
    private final String storageColumn;
    private final String liveCacheExpression;
    private final String historicalExpression;

    SortKey(ToDoubleFunction<PerformanceRecord> recordMetric, ToDoubleFunction<HistoryEntry> entryMetric,
            String storageColumn, String liveCacheExpression, String historicalExpression) {
        this.recordMetric = recordMetric;
        this.entryMetric = entryMetric;
        this.storageColumn = storageColumn;
        this.liveCacheExpression = liveCacheExpression;
        this.historicalExpression = historicalExpression;
    }

    public double metricOf(PerformanceRecord record) {
        return recordMetric.applyAsDouble(record);
    }

    public double metricOf(HistoryEntry entry) {
        return entryMetric.applyAsDouble(entry);
    }

    public String getStorageColumn() {
        return storageColumn;
    }

    public String getLiveCacheExpression() {
        return liveCacheExpression;
    }

    public String getHistoricalExpression() {
        return historicalExpression;
    }

    /**
     * Accepts {@code elapsed_time}, {@code ELAPSED_TIME}, {@code elapsed-time}; blank means ELAPSED_TIME.
     */
    public static SortKey fromParam(String value) {
        if (value == null || value.isBlank()) {
            return ELAPSED_TIME;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SortKey key : values()) {
            if (key.name().equals(normalized)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unsupported sortBy: " + value);
    }
}
