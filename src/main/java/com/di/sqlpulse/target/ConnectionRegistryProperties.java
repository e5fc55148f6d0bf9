package com.di.sqlpulse.target;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Monitored connections and their pool settings, bound from {@code sqlpulse.connections[*]}
 * and {@code sqlpulse.target-pool.*}.
 */
@Data
@ConfigurationProperties(prefix = "sqlpulse")
public class ConnectionRegistryProperties {

    private List<Connection> connections = new ArrayList<>();
    private TargetPool targetPool = new TargetPool();

    @Data
    public static class Connection {
        private String id;
        private String name;
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName = "oracle.jdbc.OracleDriver";
        /** Declared edition string, e.g. "Enterprise Edition" or "Standard Edition 2". */
        private String edition;
    }

    @Data
    public static class TargetPool {
        private int maximumPoolSize = 4;
        private int minimumIdle = 0;
        private long idleTimeoutMs = 300_000;
        private long connectionTimeoutMs = 10_000;
        private long maxLifetimeMs = 1_800_000;
    }
}
