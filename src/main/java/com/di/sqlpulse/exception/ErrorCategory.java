package com.di.sqlpulse.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for logs, collection-log details and API error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL or a column the engine version does not have"),
    PERMISSION_ERROR("Permission denied", "Missing grant or unlicensed dictionary view"),
    DATABASE_ERROR("Database error", "General database operation error"),
    TIER_UNAVAILABLE("Telemetry tier unavailable", "The requested telemetry tier could not answer"),
    NOT_FOUND("Not found", "Requested statement or connection does not exist"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    AUTHENTICATION_ERROR("Authentication error", "Authentication or authorization failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isNotFound, NOT_FOUND);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(t -> t instanceof DataIntegrityViolationException, CONSTRAINT_VIOLATION);
        MATCHERS.put(t -> t instanceof DataAccessResourceFailureException, CONNECTION_ERROR);
        MATCHERS.put(t -> t instanceof TierUnavailableException, TIER_UNAVAILABLE);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        // driver errors wrapped by the target client keep their own category
        if (exception instanceof TargetQueryException && exception.getCause() instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        ErrorCategory byVendorCode = ORACLE_ERROR_CODES.get(sqlEx.getErrorCode());
        if (byVendorCode != null) {
            return byVendorCode;
        }
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "timeout", "cancel")) return TIMEOUT_ERROR;
            if (containsAny(lower, "connection", "refused", "closed", "listener")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "insufficient privileges", "does not exist")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "value too large")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "invalid identifier", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "22", CONSTRAINT_VIOLATION,
            "23", CONSTRAINT_VIOLATION,
            "28", AUTHENTICATION_ERROR,
            "42", SQL_SYNTAX_ERROR
    );

    private static final Map<Integer, ErrorCategory> ORACLE_ERROR_CODES = Map.of(
            904, SQL_SYNTAX_ERROR,
            936, SQL_SYNTAX_ERROR,
            942, PERMISSION_ERROR,
            1031, PERMISSION_ERROR,
            1017, AUTHENTICATION_ERROR,
            1013, TIMEOUT_ERROR,
            12514, CONNECTION_ERROR,
            12541, CONNECTION_ERROR,
            17002, CONNECTION_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isNotFound(Throwable t) {
        return t instanceof StatementNotFoundException || t instanceof ConnectionNotFoundException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException && !(t instanceof java.io.FileNotFoundException));
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof java.sql.SQLTimeoutException
                || t instanceof QueryTimeoutException
                || (t instanceof TargetQueryException tq && tq.isTimeout())
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.time.format.DateTimeParseException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.beans.factory.UnsatisfiedDependencyException;
    }

    private static boolean isAuthenticationError(Throwable t) {
        return messageContains(t, "authentication", "unauthorized", "invalid username/password", "login failed");
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
