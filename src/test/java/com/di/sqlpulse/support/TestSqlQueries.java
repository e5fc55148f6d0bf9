package com.di.sqlpulse.support;

import com.di.sqlpulse.sql.SqlQueriesProperties;

/**
 * Query templates whose first word names the query, so fakes can route on it. Markers are kept
 * so substitution can be asserted on.
 */
public final class TestSqlQueries {

    public static final String ASH_PROBE = "activeSessionProbe";
    public static final String COLLECT = "liveCacheCollect";
    public static final String COLLECT_LEGACY = "liveCacheCollectLegacy";
    public static final String LIVE_WINDOW = "liveCacheWindow";
    public static final String LIVE_CURRENT = "liveCacheCurrent";
    public static final String LIVE_BY_SQL_ID = "liveCacheBySqlId";
    public static final String HISTORICAL_WINDOW = "historicalWindow";
    public static final String ASH_WINDOW = "activeSessionWindow";
    public static final String HISTORICAL_TREND = "historicalStatementTrend";

    private TestSqlQueries() {
    }

    public static SqlQueriesProperties create() {
        SqlQueriesProperties sql = new SqlQueriesProperties();
        SqlQueriesProperties.Tiers tiers = sql.getTiers();
        tiers.setActiveSessionProbe(ASH_PROBE);
        tiers.setLiveCacheCollect(COLLECT + " WHERE executions >= ? {excludedSchemas}");
        tiers.setLiveCacheCollectLegacy(COLLECT_LEGACY + " WHERE executions >= ? {excludedSchemas}");
        tiers.setLiveCacheWindow(LIVE_WINDOW + " WHERE last_active_time {endOp} ? ORDER BY {orderBy}");
        tiers.setLiveCacheCurrent(LIVE_CURRENT + " ORDER BY {orderBy}");
        tiers.setLiveCacheBySqlId(LIVE_BY_SQL_ID + " WHERE sql_id = ?");
        tiers.setHistoricalWindow(HISTORICAL_WINDOW + " WHERE begin_interval_time >= ? AND {snapshotBound} ? ORDER BY {orderBy}");
        tiers.setActiveSessionWindow(ASH_WINDOW + " WHERE sample_time {endOp} ?");
        tiers.setHistoricalStatementTrend(HISTORICAL_TREND + " WHERE sql_id = ?");
        return sql;
    }

    static String nameOf(String sql) {
        String trimmed = sql.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
