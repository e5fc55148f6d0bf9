package com.di.sqlpulse.history;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** One snapshot interval of a statement's trend. Totals cover the interval only. */
@Value
@Builder
public class StatementTrendPoint {
    LocalDateTime timestamp;
    long executions;
    double elapsedTimeSec;
    double cpuTimeSec;
    long bufferGets;
    long diskReads;
    long rowsProcessed;
    double avgElapsedMs;
    double avgCpuMs;
}
