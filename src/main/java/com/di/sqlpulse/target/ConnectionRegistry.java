package com.di.sqlpulse.target;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of monitored connections. Connection CRUD and credential storage live elsewhere.
 */
public interface ConnectionRegistry {

    Optional<MonitoredConnection> find(String connectionId);

    List<MonitoredConnection> findAll();
}
