package com.di.sqlpulse.collection;

/**
 * A record durable storage rejected during per-record fallback.
 */
public record RecordError(String sqlId, String message) {

    @Override
    public String toString() {
        return sqlId + ": " + message;
    }
}
