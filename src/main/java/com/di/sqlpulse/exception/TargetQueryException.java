package com.di.sqlpulse.exception;

import java.sql.SQLException;

/**
 * A query against a monitored database failed. Keeps the vendor error code so callers can
 * react to specific engine errors (e.g. ORA-00904 for a column the engine version lacks).
 */
public class TargetQueryException extends RuntimeException {

    /** ORA-00904: invalid identifier. */
    public static final int INVALID_IDENTIFIER = 904;
    /** ORA-01013: user requested cancel, raised when the query timeout fires. */
    public static final int QUERY_CANCELLED = 1013;

    private final String connectionId;
    private final int vendorCode;

    public TargetQueryException(String connectionId, String message, SQLException cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.connectionId = connectionId;
        this.vendorCode = cause.getErrorCode();
    }

    public TargetQueryException(String connectionId, String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.connectionId = connectionId;
        this.vendorCode = 0;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public int getVendorCode() {
        return vendorCode;
    }

    public boolean isInvalidIdentifier() {
        return vendorCode == INVALID_IDENTIFIER
                || (getMessage() != null && getMessage().contains("ORA-00904"));
    }

    public boolean isTimeout() {
        return vendorCode == QUERY_CANCELLED || getCause() instanceof java.sql.SQLTimeoutException;
    }
}
