package com.di.sqlpulse.history;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SortKey Tests")
class SortKeyTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "elapsed_time, ELAPSED_TIME",
            "CPU_TIME, CPU_TIME",
            "buffer-gets, BUFFER_GETS",
            "' disk_reads ', DISK_READS",
            "Executions, EXECUTIONS"
    })
    @DisplayName("Should accept any casing and dashes")
    void testFromParam(String param, SortKey expected) {
        assertEquals(expected, SortKey.fromParam(param));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @DisplayName("Should default to elapsed time")
    void testFromParam_Blank(String param) {
        assertEquals(SortKey.ELAPSED_TIME, SortKey.fromParam(param));
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void testFromParam_Unknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SortKey.fromParam("sql_text; drop table x"));
        assertTrue(e.getMessage().startsWith("Unsupported sortBy"));
    }

    @Test
    @DisplayName("Should guard every per-execution expression against zero executions")
    void testExpressions_DivideSafely() {
        for (SortKey key : SortKey.values()) {
            if (key == SortKey.EXECUTIONS) {
                continue;
            }
            assertTrue(key.getLiveCacheExpression().contains("DECODE(executions, 0, 1, executions)"), key.name());
            assertTrue(key.getHistoricalExpression().contains("DECODE(SUM(ss.executions_delta), 0, 1"), key.name());
        }
    }
}
