package com.di.sqlpulse.util;

import com.di.sqlpulse.exception.InvalidIdentifierException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input validation for identifiers that end up inside target-database queries.
 * Rejected input never reaches a tier.
 */
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Patterns
    // ============================================================================

    /** Engine statement ids: 13 lowercase base-32 characters. */
    private static final Pattern SQL_ID_PATTERN = Pattern.compile("^[a-z0-9]{13}$");

    /** Unquoted Oracle schema names (upper case after normalization). */
    private static final Pattern SCHEMA_NAME_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_$#]{0,127}$");

    // ============================================================================
    // Statement ids
    // ============================================================================

    /**
     * Normalizes (trim + lowercase) and validates a statement id.
     *
     * @param sqlId raw id from the caller
     * @return the normalized id
     * @throws InvalidIdentifierException if the id is blank or malformed
     */
    public static String normalizeSqlId(String sqlId) {
        if (sqlId == null || sqlId.isBlank()) {
            throw new InvalidIdentifierException("sqlId", sqlId);
        }
        String normalized = sqlId.trim().toLowerCase(Locale.ROOT);
        if (!SQL_ID_PATTERN.matcher(normalized).matches()) {
            throw new InvalidIdentifierException("sqlId", sqlId);
        }
        return normalized;
    }

    public static boolean isValidSqlId(String sqlId) {
        return sqlId != null && SQL_ID_PATTERN.matcher(sqlId.trim().toLowerCase(Locale.ROOT)).matches();
    }

    // ============================================================================
    // Schema names
    // ============================================================================

    /** Normalizes (trim + uppercase) and validates a schema name. */
    public static String normalizeSchemaName(String schema) {
        if (schema == null || schema.isBlank()) {
            throw new InvalidIdentifierException("schema", schema);
        }
        String normalized = schema.trim().toUpperCase(Locale.ROOT);
        if (!SCHEMA_NAME_PATTERN.matcher(normalized).matches()) {
            throw new InvalidIdentifierException("schema", schema);
        }
        return normalized;
    }
}
