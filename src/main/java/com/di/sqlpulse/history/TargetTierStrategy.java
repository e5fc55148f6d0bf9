package com.di.sqlpulse.history;

import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.tier.SqlStatRowMapper;
import com.di.sqlpulse.tier.Tier;
import com.di.sqlpulse.util.TelemetryMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base for cascade steps that read a monitored database. Runs one stat query with the history
 * timeout and turns any failure into an unavailable attempt.
 */
@Slf4j
abstract class TargetTierStrategy implements TierQueryStrategy {

    protected final TargetDatabaseClient client;
    protected final SqlQueriesProperties sql;
    protected final HistoryProperties properties;
    protected final TelemetryMetrics metrics;

    protected TargetTierStrategy(TargetDatabaseClient client, SqlQueriesProperties sql, HistoryProperties properties,
                                 TelemetryMetrics metrics) {
        this.client = client;
        this.sql = sql;
        this.properties = properties;
        this.metrics = metrics;
    }

    protected abstract Tier tier();

    @Override
    public String name() {
        return tier().getView();
    }

    protected TierAttempt read(MonitoredConnection connection, String query, List<?> args, String source,
                               String warning) {
        try {
            List<HistoryEntry> rows = client.query(connection, query, args,
                            Duration.ofSeconds(properties.getQueryTimeoutSeconds()), SqlStatRowMapper.INSTANCE)
                    .stream()
                    .map(row -> HistoryEntry.fromStatRow(row, source))
                    .collect(Collectors.toList());
            log.debug("[HISTORY] {} returned {} row(s) for {}", tier().getView(), rows.size(), connection.id());
            return TierAttempt.answered(source, rows, warning);
        } catch (RuntimeException e) {
            metrics.recordTierFailure(tier());
            log.warn("[HISTORY] Tier {} ({}) unavailable for {}: {}", tier().getCode(), tier().getView(),
                    connection.id(), e.getMessage());
            return TierAttempt.unavailable(tier().getView() + ": " + e.getMessage());
        }
    }

    protected static String withOrderAndBound(String query, String orderExpression, String endOperator) {
        return query.replace(SqlQueriesProperties.ORDER_BY, orderExpression + " DESC")
                .replace(SqlQueriesProperties.END_OPERATOR, endOperator);
    }
}
