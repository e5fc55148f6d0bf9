package com.di.sqlpulse.exception;

/**
 * No monitored connection is registered under the given id. Mapped to HTTP 404.
 */
public class ConnectionNotFoundException extends RuntimeException {

    public ConnectionNotFoundException(String connectionId) {
        super("Unknown connection: " + connectionId);
    }
}
