package com.di.sqlpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * History read settings ({@code sqlpulse.history.*}).
 */
@Data
@ConfigurationProperties(prefix = "sqlpulse.history")
public class HistoryProperties {

    private int queryTimeoutSeconds = 10;
    /** Row cap applied inside the live-tier queries. */
    private int tierRowCap = 100;
    private int defaultLimit = 500;
    private int maxLimit = 1000;
    /** Look-back of the per-statement trend in the snapshot repository. */
    private int trendDays = 7;
}
