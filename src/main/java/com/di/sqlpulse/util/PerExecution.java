package com.di.sqlpulse.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-execution averages over cumulative engine counters. Execution counts of zero are
 * treated as one so a statement that was parsed but never ran reports zero cost.
 */
public final class PerExecution {

    private static final double MICROS_PER_MILLI = 1_000d;

    private PerExecution() {
    }

    public static double average(double total, long executions) {
        return total / Math.max(executions, 1L);
    }

    /** Engine times are microseconds; result is milliseconds rounded to two decimals. */
    public static double averageMillis(double totalMicros, long executions) {
        return round2(average(totalMicros, executions) / MICROS_PER_MILLI);
    }

    public static long averageCount(double total, long executions) {
        return Math.round(average(total, executions));
    }

    public static double microsToMillis(double micros) {
        return round2(micros / MICROS_PER_MILLI);
    }

    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0d;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
