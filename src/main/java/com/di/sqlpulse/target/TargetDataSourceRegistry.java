package com.di.sqlpulse.target;

import com.di.sqlpulse.util.ConnectionPoolLogger;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One HikariCP pool per monitored connection, created lazily on first use.
 * Pools are keyed by connection id plus JDBC url and username, so a registry change that
 * points an id at a different database gets a fresh pool.
 */
@Slf4j
@Component
public class TargetDataSourceRegistry {

    private final ConcurrentMap<String, HikariDataSource> dataSourceCache = new ConcurrentHashMap<>();
    private final ConnectionRegistryProperties.TargetPool poolSettings;

    /** Incrementing counter for stable, positive pool IDs. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    public TargetDataSourceRegistry(ConnectionRegistryProperties properties) {
        this.poolSettings = properties.getTargetPool();
    }

    public DataSource getOrCreate(MonitoredConnection connection) {
        String connectionKey = connectionKey(connection);
        return dataSourceCache.computeIfAbsent(connectionKey, key -> {
            log.info("[POOL] Creating | connection={} | url={} | user={} | maxPoolSize={}",
                    connection.id(), sanitizeUrl(connection.jdbcUrl()), connection.username(),
                    poolSettings.getMaximumPoolSize());

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(connection.jdbcUrl());
            hikariConfig.setUsername(connection.username());
            hikariConfig.setPassword(connection.password());
            if (connection.driverClassName() != null && !connection.driverClassName().isBlank()) {
                hikariConfig.setDriverClassName(connection.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(Math.max(1, poolSettings.getMaximumPoolSize()));
            hikariConfig.setMinimumIdle(Math.min(poolSettings.getMinimumIdle(), poolSettings.getMaximumPoolSize()));
            hikariConfig.setIdleTimeout(poolSettings.getIdleTimeoutMs());
            hikariConfig.setConnectionTimeout(poolSettings.getConnectionTimeoutMs());
            hikariConfig.setMaxLifetime(poolSettings.getMaxLifetimeMs());
            hikariConfig.setReadOnly(true);
            // an unreachable target must not fail the caller at pool creation; the first query reports it
            hikariConfig.setInitializationFailTimeout(-1);
            hikariConfig.setPoolName("SqlPulse-" + poolIdCounter.incrementAndGet() + "-" + shortKey(connection.id()));

            HikariDataSource dataSource = new HikariDataSource(hikariConfig);
            ConnectionPoolLogger.logPoolStats(dataSource, "created");
            return dataSource;
        });
    }

    /** Closes every pool registered for the given connection id. */
    public void evict(String connectionId) {
        String prefix = connectionId + "|";
        dataSourceCache.keySet().removeIf(key -> {
            if (!key.startsWith(prefix)) {
                return false;
            }
            close(key, dataSourceCache.get(key));
            return true;
        });
    }

    @PreDestroy
    public void closeAll() {
        log.info("[POOL] Closing all target pools (count: {})", dataSourceCache.size());
        dataSourceCache.forEach(this::close);
        dataSourceCache.clear();
    }

    public int getActivePoolCount() {
        return dataSourceCache.size();
    }

    private void close(String key, HikariDataSource dataSource) {
        if (dataSource == null) {
            return;
        }
        try {
            ConnectionPoolLogger.logPoolStats(dataSource, "closing");
            dataSource.close();
            log.debug("[POOL] Closed pool for {}", key);
        } catch (RuntimeException e) {
            log.warn("[POOL] Error closing pool for {}", key, e);
        }
    }

    private static String connectionKey(MonitoredConnection connection) {
        // password is not part of the key
        return connection.id() + "|" + connection.jdbcUrl() + "|" + connection.username();
    }

    private static String shortKey(String connectionId) {
        String safe = connectionId == null ? "" : connectionId.replaceAll("[^a-zA-Z0-9_]", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
