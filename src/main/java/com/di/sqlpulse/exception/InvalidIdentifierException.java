package com.di.sqlpulse.exception;

/**
 * A statement id or schema name failed validation. Mapped to HTTP 400.
 */
public class InvalidIdentifierException extends IllegalArgumentException {

    private final String field;

    public InvalidIdentifierException(String field, String value) {
        super("Invalid " + field + ": " + (value == null ? "<null>" : "'" + value + "'"));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
