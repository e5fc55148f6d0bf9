package com.di.sqlpulse.collection;

import com.di.sqlpulse.grade.PerformanceGrade;
import com.di.sqlpulse.grade.PerformanceGrader;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.util.PerExecution;
import com.di.sqlpulse.util.TextLimits;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * One observed statement in one collection run. Immutable; removed only by retention.
 * The collection date and hour are read from {@link #collectedAt} and cannot disagree with it.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceRecord {
    String connectionId;
    String sqlId;
    Long planHashValue;
    String parsingSchemaName;
    String module;
    String action;
    String sqlText;
    long executions;
    double avgElapsedTimeMs;
    double avgCpuTimeMs;
    long avgBufferGets;
    long avgDiskReads;
    long rowsProcessed;
    long physicalReadRequests;
    long physicalWriteRequests;
    long directReads;
    long directWrites;
    double applicationWaitTimeMs;
    double concurrencyWaitTimeMs;
    double clusterWaitTimeMs;
    double userIoWaitTimeMs;
    PerformanceGrade performanceGrade;
    /** Tier the record was read from, e.g. {@code v$sql}. */
    String source;
    ZonedDateTime collectedAt;

    public LocalDate getCollectionDate() {
        return collectedAt.toLocalDate();
    }

    public int getCollectionHour() {
        return collectedAt.getHour();
    }

    /**
     * Builds a record from a live-cache row: derives averages, grades, and truncates text
     * fields to what durable storage accepts.
     */
    public static PerformanceRecord fromLiveCache(String connectionId, SqlStatRow row, ZonedDateTime collectedAt,
                                                  int sqlTextMaxBytes, int moduleMaxChars) {
        double avgElapsedMs = row.avgElapsedMs();
        long avgBufferGets = row.avgBufferGets();
        return PerformanceRecord.builder()
                .connectionId(connectionId)
                .sqlId(row.getSqlId())
                .planHashValue(row.getPlanHashValue())
                .parsingSchemaName(row.getParsingSchemaName())
                .module(TextLimits.truncateChars(row.getModule(), moduleMaxChars))
                .action(TextLimits.truncateChars(row.getAction(), moduleMaxChars))
                .sqlText(TextLimits.truncateUtf8(row.getSqlText(), sqlTextMaxBytes))
                .executions(row.getExecutions())
                .avgElapsedTimeMs(avgElapsedMs)
                .avgCpuTimeMs(row.avgCpuMs())
                .avgBufferGets(avgBufferGets)
                .avgDiskReads(row.avgDiskReads())
                .rowsProcessed(row.getRowsProcessed())
                .physicalReadRequests(row.getPhysicalReadRequests())
                .physicalWriteRequests(row.getPhysicalWriteRequests())
                .directReads(row.getDirectReads())
                .directWrites(row.getDirectWrites())
                .applicationWaitTimeMs(PerExecution.microsToMillis(row.getApplicationWaitUs()))
                .concurrencyWaitTimeMs(PerExecution.microsToMillis(row.getConcurrencyWaitUs()))
                .clusterWaitTimeMs(PerExecution.microsToMillis(row.getClusterWaitUs()))
                .userIoWaitTimeMs(PerExecution.microsToMillis(row.getUserIoWaitUs()))
                .performanceGrade(PerformanceGrader.grade(avgElapsedMs, avgBufferGets))
                .source("v$sql")
                .collectedAt(collectedAt)
                .build();
    }
}
