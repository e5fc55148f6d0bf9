package com.di.sqlpulse.util;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Logs HikariCP pool statistics for the per-target pools: at creation, on close, and after a
 * failed target query when debugging connection exhaustion.
 */
@Slf4j
public final class ConnectionPoolLogger {

    private ConnectionPoolLogger() {}

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool.
     *
     * @param dataSource the DataSource (stats only for com.zaxxer.hikari.HikariDataSource)
     * @param phase      when this is being logged (e.g. "created", "closing", "query failed")
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (dataSource == null) {
            return;
        }
        if (!(dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari)) {
            log.debug("Pool stats not available (not HikariCP): phase={}", phase);
            return;
        }
        try {
            if (hikari.getHikariPoolMXBean() == null) {
                log.info("[POOL] {} | pool={} | maxSize={} | not started", phase, hikari.getPoolName(),
                        hikari.getMaximumPoolSize());
                return;
            }
            int active = hikari.getHikariPoolMXBean().getActiveConnections();
            int idle = hikari.getHikariPoolMXBean().getIdleConnections();
            int total = hikari.getHikariPoolMXBean().getTotalConnections();
            int waiting = hikari.getHikariPoolMXBean().getThreadsAwaitingConnection();
            log.info("[POOL] {} | pool={} | maxSize={} | active={}, idle={}, total={}, waiting={}",
                    phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), active, idle, total, waiting);
        } catch (RuntimeException e) {
            log.debug("Could not read pool stats for phase {}: {}", phase, e.getMessage());
        }
    }
}
