package com.di.sqlpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Collection run and scheduler settings ({@code sqlpulse.collection.*}) plus the defaults used
 * for connections that have no stored settings.
 */
@Data
@ConfigurationProperties(prefix = "sqlpulse.collection")
public class CollectionProperties {

    /** Start a timer for every stored, enabled setting at startup. */
    private boolean autoStart = false;
    private int schedulerPoolSize = 4;
    /** Records per insert chunk; a failed chunk is retried record by record. */
    private int batchSize = 500;
    private int queryTimeoutSeconds = 60;
    private int sqlTextMaxBytes = 4000;
    private int moduleMaxChars = 64;
    private Defaults defaults = new Defaults();

    @Data
    public static class Defaults {
        private boolean enabled = true;
        private int intervalMinutes = 10;
        private int retentionDays = 30;
        private long minExecutions = 1;
        private double minElapsedTimeMs = 0;
        private int rowLimit = 500;
        private boolean collectAllHours = true;
        private int collectStartHour = 0;
        private int collectEndHour = 23;
        private List<String> excludedSchemas = new ArrayList<>(List.of(
                "SYS", "SYSTEM", "DBSNMP", "SYSMAN", "OUTLN", "MDSYS", "ORDSYS",
                "EXFSYS", "WMSYS", "CTXSYS", "XDB"));
    }
}
