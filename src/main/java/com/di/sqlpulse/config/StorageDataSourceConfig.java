package com.di.sqlpulse.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Pool, JdbcTemplate and transaction template for the durable telemetry store (PostgreSQL).
 * Only created when {@code sqlpulse.storage.persistence-enabled=true}; DataSource
 * auto-configuration is excluded so monitored-target pools never become the primary DataSource.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "true")
public class StorageDataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource storageDataSource(StorageProperties storage) {
        if (storage.getJdbcUrl() == null || storage.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("sqlpulse.storage.jdbc-url is required when persistence is enabled");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(storage.getJdbcUrl());
        config.setUsername(storage.getUsername());
        config.setPassword(storage.getPassword());
        config.setDriverClassName(storage.getDriverClassName());
        config.setMaximumPoolSize(storage.getMaximumPoolSize());
        config.setPoolName("SqlPulse-storage");
        log.info("[STORAGE] Durable telemetry store enabled | url={}", storage.getJdbcUrl());
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate storageJdbcTemplate(HikariDataSource storageDataSource) {
        return new JdbcTemplate(storageDataSource);
    }

    @Bean
    public TransactionTemplate storageTransactionTemplate(HikariDataSource storageDataSource) {
        return new TransactionTemplate(new DataSourceTransactionManager(storageDataSource));
    }
}
