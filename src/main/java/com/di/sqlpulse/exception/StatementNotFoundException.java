package com.di.sqlpulse.exception;

/**
 * The requested statement is not present in the live cache of the target. Mapped to HTTP 404.
 */
public class StatementNotFoundException extends RuntimeException {

    private final String sqlId;

    public StatementNotFoundException(String connectionId, String sqlId) {
        super("SQL_ID " + sqlId + " not found on connection " + connectionId);
        this.sqlId = sqlId;
    }

    public String getSqlId() {
        return sqlId;
    }
}
