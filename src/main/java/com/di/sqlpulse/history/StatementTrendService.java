package com.di.sqlpulse.history;

import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.exception.ConnectionNotFoundException;
import com.di.sqlpulse.exception.StatementNotFoundException;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.ConnectionRegistry;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.tier.EditionCapability;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.tier.SqlStatRowMapper;
import com.di.sqlpulse.tier.Tier;
import com.di.sqlpulse.util.InputValidator;
import com.di.sqlpulse.util.PerExecution;
import com.di.sqlpulse.util.TelemetryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Snapshot-by-snapshot history of one statement over the last {@code sqlpulse.history.trend-days}.
 * Falls back to the statement's current live-cache totals as a single point when the snapshot
 * repository is not licensed, fails or has nothing.
 */
@Slf4j
@Service
public class StatementTrendService {

    private static final double MICROS_PER_SECOND = 1_000_000d;

    static final RowMapper<StatementTrendPoint> TREND_POINT_MAPPER = (rs, rowNum) -> {
        long executions = rs.getLong("executions");
        double elapsedUs = rs.getDouble("elapsed_time");
        double cpuUs = rs.getDouble("cpu_time");
        return StatementTrendPoint.builder()
                .timestamp(toLocalDateTime(rs.getTimestamp("snapshot_time")))
                .executions(executions)
                .elapsedTimeSec(elapsedUs / MICROS_PER_SECOND)
                .cpuTimeSec(cpuUs / MICROS_PER_SECOND)
                .bufferGets(rs.getLong("buffer_gets"))
                .diskReads(rs.getLong("disk_reads"))
                .rowsProcessed(rs.getLong("rows_processed"))
                .avgElapsedMs(PerExecution.averageMillis(elapsedUs, executions))
                .avgCpuMs(PerExecution.averageMillis(cpuUs, executions))
                .build();
    };

    private final ConnectionRegistry registry;
    private final TargetDatabaseClient client;
    private final SqlQueriesProperties sql;
    private final HistoryProperties properties;
    private final TelemetryMetrics metrics;
    private final Clock clock;

    public StatementTrendService(ConnectionRegistry registry, TargetDatabaseClient client, SqlQueriesProperties sql,
                                 HistoryProperties properties, TelemetryMetrics metrics, Clock clock) {
        this.registry = registry;
        this.client = client;
        this.sql = sql;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public StatementTrend trend(String connectionId, String rawSqlId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        String sqlId = InputValidator.normalizeSqlId(rawSqlId);
        MonitoredConnection connection = registry.find(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        Duration timeout = Duration.ofSeconds(properties.getQueryTimeoutSeconds());

        if (connection.capability() != EditionCapability.LIMITED) {
            try {
                List<StatementTrendPoint> points = client.query(connection,
                        sql.getTiers().getHistoricalStatementTrend(),
                        List.of(sqlId, properties.getTrendDays(), properties.getTierRowCap()),
                        timeout, TREND_POINT_MAPPER);
                if (!points.isEmpty()) {
                    return build(connectionId, sqlId, SourceTag.TIER_B, points);
                }
                log.debug("[HISTORY] No snapshots for {} on {}, using live cache", sqlId, connectionId);
            } catch (RuntimeException e) {
                metrics.recordTierFailure(Tier.HISTORICAL_REPOSITORY);
                log.info("[HISTORY] Snapshot trend unavailable for {} on {}: {}", sqlId, connectionId, e.getMessage());
            }
        }

        List<SqlStatRow> current;
        try {
            current = client.query(connection, sql.getTiers().getLiveCacheBySqlId(), List.of(sqlId), timeout,
                    SqlStatRowMapper.INSTANCE);
        } catch (RuntimeException e) {
            metrics.recordTierFailure(Tier.LIVE_CACHE);
            throw e;
        }
        if (current.isEmpty()) {
            throw new StatementNotFoundException(connectionId, sqlId);
        }
        SqlStatRow row = current.get(0);
        StatementTrendPoint point = StatementTrendPoint.builder()
                .timestamp(LocalDateTime.now(clock))
                .executions(row.getExecutions())
                .elapsedTimeSec(row.getElapsedTimeUs() / MICROS_PER_SECOND)
                .cpuTimeSec(row.getCpuTimeUs() / MICROS_PER_SECOND)
                .bufferGets(Math.round(row.getBufferGets()))
                .diskReads(Math.round(row.getDiskReads()))
                .rowsProcessed(row.getRowsProcessed())
                .avgElapsedMs(row.avgElapsedMs())
                .avgCpuMs(row.avgCpuMs())
                .build();
        return build(connectionId, sqlId, SourceTag.LIVE_CACHE, List.of(point));
    }

    private StatementTrend build(String connectionId, String sqlId, String source, List<StatementTrendPoint> points) {
        return StatementTrend.builder()
                .success(true)
                .connectionId(connectionId)
                .sqlId(sqlId)
                .source(source)
                .data(points)
                .timestamp(clock.instant())
                .build();
    }

    private static LocalDateTime toLocalDateTime(Timestamp ts) {
        return ts != null ? ts.toLocalDateTime() : null;
    }
}
