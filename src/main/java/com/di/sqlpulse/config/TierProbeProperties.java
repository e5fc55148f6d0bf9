package com.di.sqlpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "sqlpulse.tier-probe")
public class TierProbeProperties {

    private int timeoutSeconds = 2;
    private int cacheTtlSeconds = 60;
    private int cacheMaxSize = 500;
}
