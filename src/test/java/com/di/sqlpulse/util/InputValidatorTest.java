package com.di.sqlpulse.util;

import com.di.sqlpulse.exception.InvalidIdentifierException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Statement ids
    // ============================================================================

    @Test
    @DisplayName("Should normalize a valid statement id")
    void testNormalizeSqlId_Valid() {
        assertEquals("7zq9fh0n3kx2a", InputValidator.normalizeSqlId("  7ZQ9FH0N3KX2A "));
        assertTrue(InputValidator.isValidSqlId("abcdefghij123"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "abc", "abcdefghij1234", "abcdefghij12!", "abc' OR '1'='1", "abcdefghij 12"})
    @DisplayName("Should reject malformed statement ids")
    void testNormalizeSqlId_Invalid(String sqlId) {
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
                () -> InputValidator.normalizeSqlId(sqlId));
        assertEquals("sqlId", ex.getField());
        assertFalse(InputValidator.isValidSqlId(sqlId));
    }

    // ============================================================================
    // Schema names
    // ============================================================================

    @Test
    @DisplayName("Should upper-case valid schema names")
    void testNormalizeSchemaName_Valid() {
        assertEquals("APP_OWNER", InputValidator.normalizeSchemaName("app_owner"));
        assertEquals("SYS$UMF", InputValidator.normalizeSchemaName("SYS$UMF"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"1ABC", "APP OWNER", "APP;DROP", "\"QUOTED\""})
    @DisplayName("Should reject invalid schema names")
    void testNormalizeSchemaName_Invalid(String schema) {
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
                () -> InputValidator.normalizeSchemaName(schema));
        assertEquals("schema", ex.getField());
    }
}
