package com.di.sqlpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Durable storage for collected telemetry ({@code sqlpulse.storage.*}). In-memory stores are
 * used unless {@code persistence-enabled=true}.
 */
@Data
@ConfigurationProperties(prefix = "sqlpulse.storage")
public class StorageProperties {

    private boolean persistenceEnabled = false;
    private String jdbcUrl;
    private String username;
    private String password;
    private String driverClassName = "org.postgresql.Driver";
    private int maximumPoolSize = 5;
}
