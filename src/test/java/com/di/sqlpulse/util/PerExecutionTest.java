package com.di.sqlpulse.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PerExecution Tests")
class PerExecutionTest {

    @Test
    @DisplayName("Should treat zero executions as one")
    void testAverage_ZeroExecutions() {
        assertEquals(1500d, PerExecution.average(1500, 0));
        assertEquals(1.5, PerExecution.averageMillis(1500, 0));
        assertEquals(42L, PerExecution.averageCount(42, 0));
    }

    @Test
    @DisplayName("Should convert microseconds to milliseconds per execution")
    void testAverageMillis() {
        // 10 executions, 25,000 us total -> 2.5 ms each
        assertEquals(2.5, PerExecution.averageMillis(25_000, 10));
        assertEquals(0.33, PerExecution.averageMillis(1_000, 3));
    }

    @Test
    @DisplayName("Should round counts half up")
    void testAverageCount() {
        assertEquals(3L, PerExecution.averageCount(5, 2));
        assertEquals(2L, PerExecution.averageCount(4, 2));
    }

    @Test
    @DisplayName("Should round to two decimals and map non-finite to zero")
    void testRound2() {
        assertEquals(1.24, PerExecution.round2(1.235));
        assertEquals(0d, PerExecution.round2(Double.NaN));
        assertEquals(0d, PerExecution.round2(Double.POSITIVE_INFINITY));
        assertEquals(12.35, PerExecution.microsToMillis(12_345));
    }
}
