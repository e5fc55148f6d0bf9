package com.di.sqlpulse.target;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry backed by {@code sqlpulse.connections} in application.yml. Entries without an id or
 * JDBC url are skipped with a warning; a duplicate id keeps the first entry.
 */
@Slf4j
@Component
public class PropertiesConnectionRegistry implements ConnectionRegistry {

    private final Map<String, MonitoredConnection> byId = new LinkedHashMap<>();

    public PropertiesConnectionRegistry(ConnectionRegistryProperties properties) {
        for (ConnectionRegistryProperties.Connection c : properties.getConnections()) {
            if (c.getId() == null || c.getId().isBlank() || c.getJdbcUrl() == null || c.getJdbcUrl().isBlank()) {
                log.warn("[REGISTRY] Skipping connection entry without id or jdbc-url: name={}", c.getName());
                continue;
            }
            String id = c.getId().trim();
            if (byId.containsKey(id)) {
                log.warn("[REGISTRY] Duplicate connection id {} ignored", id);
                continue;
            }
            byId.put(id, new MonitoredConnection(id, c.getName() != null ? c.getName() : id, c.getJdbcUrl(),
                    c.getUsername(), c.getPassword(), c.getDriverClassName(), c.getEdition()));
        }
        log.info("[REGISTRY] {} monitored connection(s) registered: {}", byId.size(), byId.keySet());
    }

    @Override
    public Optional<MonitoredConnection> find(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(connectionId.trim()));
    }

    @Override
    public List<MonitoredConnection> findAll() {
        return List.copyOf(byId.values());
    }
}
