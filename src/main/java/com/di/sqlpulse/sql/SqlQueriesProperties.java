package com.di.sqlpulse.sql;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SQL text for monitored targets and for the durable telemetry store, loaded from
 * {@code sql-queries.yml} (imported by application.yml under {@code sqlpulse.sql}).
 * <p>
 * Tier queries carry markers that are substituted before execution:
 * {@code {orderBy}} (sort expression), {@code {endOp}} (upper-bound operator),
 * {@code {snapshotBound}} (snapshot column and operator of the upper bound),
 * {@code {excludedSchemas}} (schema filter with one bind per schema).
 */
@Data
@ConfigurationProperties(prefix = "sqlpulse.sql")
public class SqlQueriesProperties {

    public static final String ORDER_BY = "{orderBy}";
    public static final String END_OPERATOR = "{endOp}";
    public static final String EXCLUDED_SCHEMAS = "{excludedSchemas}";
    public static final String SNAPSHOT_BOUND = "{snapshotBound}";

    private Tiers tiers = new Tiers();
    private Records records = new Records();
    private Logs logs = new Logs();
    private Summaries summaries = new Summaries();
    private Settings settings = new Settings();

    /** Queries against monitored databases. Every stat query projects the column set of SqlStatRowMapper. */
    @Data
    public static class Tiers {
        private String activeSessionProbe;
        private String liveCacheCollect;
        private String liveCacheCollectLegacy;
        private String liveCacheWindow;
        private String liveCacheCurrent;
        private String liveCacheBySqlId;
        private String historicalWindow;
        private String activeSessionWindow;
        private String historicalStatementTrend;
    }

    @Data
    public static class Records {
        private String insert;
        private String findByDate;
        private String findByDateAndHours;
        private String countByConnection;
        private String deleteCollectedBefore;
    }

    @Data
    public static class Logs {
        private String insert;
        private String complete;
        private String findById;
        private String findRecent;
        private String deleteById;
        private String deleteByConnection;
        private String deleteStartedBefore;
    }

    @Data
    public static class Summaries {
        private String find;
        private String insert;
        private String update;
        private String findRange;
        private String deleteBefore;
    }

    @Data
    public static class Settings {
        private String find;
        private String findAll;
        private String insert;
        private String update;
        private String delete;
    }
}
