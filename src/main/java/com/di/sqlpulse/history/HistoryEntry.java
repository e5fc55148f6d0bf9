package com.di.sqlpulse.history;

import com.di.sqlpulse.collection.PerformanceRecord;
import com.di.sqlpulse.grade.PerformanceGrade;
import com.di.sqlpulse.grade.PerformanceGrader;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.util.PerExecution;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One statement in a history read, whichever tier answered. Times are per-execution milliseconds.
 */
@Value
@Builder(toBuilder = true)
public class HistoryEntry {
    String sqlId;
    Long planHashValue;
    String parsingSchemaName;
    String module;
    String sqlText;
    long executions;
    double avgElapsedTimeMs;
    double avgCpuTimeMs;
    long avgBufferGets;
    long avgDiskReads;
    long rowsProcessed;
    PerformanceGrade performanceGrade;
    LocalDateTime firstSeen;
    LocalDateTime lastSeen;
    String source;

    public static HistoryEntry fromRecord(PerformanceRecord record) {
        LocalDateTime collected = record.getCollectedAt() != null ? record.getCollectedAt().toLocalDateTime() : null;
        return HistoryEntry.builder()
                .sqlId(record.getSqlId())
                .planHashValue(record.getPlanHashValue())
                .parsingSchemaName(record.getParsingSchemaName())
                .module(record.getModule())
                .sqlText(record.getSqlText())
                .executions(record.getExecutions())
                .avgElapsedTimeMs(record.getAvgElapsedTimeMs())
                .avgCpuTimeMs(record.getAvgCpuTimeMs())
                .avgBufferGets(record.getAvgBufferGets())
                .avgDiskReads(record.getAvgDiskReads())
                .rowsProcessed(record.getRowsProcessed())
                .performanceGrade(record.getPerformanceGrade())
                .firstSeen(collected)
                .lastSeen(collected)
                .source(SourceTag.DATABASE)
                .build();
    }

    public static HistoryEntry fromStatRow(SqlStatRow row, String source) {
        double avgElapsedMs = PerExecution.round2(row.avgElapsedMs());
        long avgBufferGets = row.avgBufferGets();
        return HistoryEntry.builder()
                .sqlId(row.getSqlId())
                .planHashValue(row.getPlanHashValue())
                .parsingSchemaName(row.getParsingSchemaName())
                .module(row.getModule())
                .sqlText(row.getSqlText())
                .executions(row.getExecutions())
                .avgElapsedTimeMs(avgElapsedMs)
                .avgCpuTimeMs(PerExecution.round2(row.avgCpuMs()))
                .avgBufferGets(avgBufferGets)
                .avgDiskReads(row.avgDiskReads())
                .rowsProcessed(row.getRowsProcessed())
                .performanceGrade(PerformanceGrader.grade(avgElapsedMs, avgBufferGets))
                .firstSeen(row.getFirstSeen())
                .lastSeen(row.getLastSeen())
                .source(source)
                .build();
    }
}
