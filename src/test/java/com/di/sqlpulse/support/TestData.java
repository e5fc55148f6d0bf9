package com.di.sqlpulse.support;

import com.di.sqlpulse.collection.PerformanceRecord;
import com.di.sqlpulse.grade.PerformanceGrader;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.util.TelemetryMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Builders for the values most tests need.
 */
public final class TestData {

    public static final String ENTERPRISE = "Enterprise Edition";
    public static final String STANDARD = "Standard Edition 2";

    private TestData() {
    }

    public static MonitoredConnection connection(String id, String edition) {
        return new MonitoredConnection(id, id.toLowerCase() + "-db", "jdbc:oracle:thin:@//db-" + id + ":1521/ORCL",
                "monitor", "secret", "oracle.jdbc.OracleDriver", edition);
    }

    /** 13-character statement id derived from {@code n}. */
    public static String sqlId(int n) {
        return String.format("sq%011d", n);
    }

    public static Clock clockAt(LocalDateTime time) {
        return Clock.fixed(time.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    public static TelemetryMetrics metrics() {
        return new TelemetryMetrics(new SimpleMeterRegistry());
    }

    /** Live-cache style row: totals in microseconds. */
    public static SqlStatRow statRow(String sqlId, long executions, double elapsedTimeUs, double bufferGets) {
        return SqlStatRow.builder()
                .sqlId(sqlId)
                .planHashValue(1234567890L)
                .parsingSchemaName("APP")
                .module("JDBC Thin Client")
                .sqlText("SELECT * FROM orders WHERE id = :1")
                .executions(executions)
                .elapsedTimeUs(elapsedTimeUs)
                .cpuTimeUs(elapsedTimeUs / 2)
                .bufferGets(bufferGets)
                .diskReads(bufferGets / 10)
                .rowsProcessed(executions)
                .build();
    }

    public static PerformanceRecord record(String connectionId, String sqlId, LocalDateTime collectedAt,
                                           double avgElapsedMs, long avgBufferGets, long executions) {
        return PerformanceRecord.builder()
                .connectionId(connectionId)
                .sqlId(sqlId)
                .parsingSchemaName("APP")
                .module("JDBC Thin Client")
                .sqlText("SELECT 1 FROM dual")
                .executions(executions)
                .avgElapsedTimeMs(avgElapsedMs)
                .avgCpuTimeMs(avgElapsedMs / 2)
                .avgBufferGets(avgBufferGets)
                .avgDiskReads(avgBufferGets / 10)
                .rowsProcessed(executions)
                .performanceGrade(PerformanceGrader.grade(avgElapsedMs, avgBufferGets))
                .source("v$sql")
                .collectedAt(ZonedDateTime.of(collectedAt, ZoneOffset.UTC))
                .build();
    }
}
