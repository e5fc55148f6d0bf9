package com.di.sqlpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Periodic purge of expired records, summaries and collection logs ({@code sqlpulse.retention.*}).
 * Record and summary retention is per connection; log retention is global.
 */
@Data
@ConfigurationProperties(prefix = "sqlpulse.retention")
public class RetentionProperties {

    private boolean cleanupEnabled = true;
    private int cleanupIntervalHours = 24;
    private int initialDelayMinutes = 5;
    private int logRetentionDays = 7;
}
