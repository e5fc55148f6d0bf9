package com.di.sqlpulse.tier;

import com.di.sqlpulse.util.PerExecution;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One statement as reported by a tier, with cumulative totals as the engine keeps them
 * (times in microseconds). Averages are derived here so every tier divides the same way.
 */
@Value
@Builder(toBuilder = true)
public class SqlStatRow {
    String sqlId;
    Long planHashValue;
    String parsingSchemaName;
    String module;
    String action;
    String sqlText;
    long executions;
    double elapsedTimeUs;
    double cpuTimeUs;
    double bufferGets;
    double diskReads;
    long rowsProcessed;
    long physicalReadRequests;
    long physicalWriteRequests;
    long directReads;
    long directWrites;
    double applicationWaitUs;
    double concurrencyWaitUs;
    double clusterWaitUs;
    double userIoWaitUs;
    LocalDateTime firstSeen;
    LocalDateTime lastSeen;

    public double avgElapsedMs() {
        return PerExecution.averageMillis(elapsedTimeUs, executions);
    }

    public double avgCpuMs() {
        return PerExecution.averageMillis(cpuTimeUs, executions);
    }

    public long avgBufferGets() {
        return PerExecution.averageCount(bufferGets, executions);
    }

    public long avgDiskReads() {
        return PerExecution.averageCount(diskReads, executions);
    }
}
