package com.di.sqlpulse.history;

import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.exception.TierUnavailableException;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.tier.SqlStatRowMapper;
import com.di.sqlpulse.tier.Tier;
import com.di.sqlpulse.util.TelemetryMetrics;
import com.di.sqlpulse.window.TimeWindow;
import com.di.sqlpulse.window.TimeWindowResolver;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Tier C. The cache only knows each statement's last activity, so:
 * <ul>
 *   <li>date within one day of today: rows whose last activity falls in the (widened) window</li>
 *   <li>older date: current cache contents, unfiltered, with a warning</li>
 * </ul>
 */
@Component
@Order(40)
public class LiveCacheStrategy extends TargetTierStrategy {

    static final long FILTERED_MAX_AGE_DAYS = 1;

    public LiveCacheStrategy(TargetDatabaseClient client, SqlQueriesProperties sql,
                             HistoryProperties properties, TelemetryMetrics metrics) {
        super(client, sql, properties, metrics);
    }

    @Override
    protected Tier tier() {
        return Tier.LIVE_CACHE;
    }

    @Override
    public TierAttempt attempt(HistoryContext context) {
        Optional<MonitoredConnection> connection = context.getConnection();
        if (connection.isEmpty()) {
            return TierAttempt.unavailable("unknown connection");
        }
        String orderExpression = context.getSortKey().getLiveCacheExpression();
        long ageDays = ChronoUnit.DAYS.between(context.getWindow().date(), context.getToday());
        if (ageDays <= FILTERED_MAX_AGE_DAYS) {
            TimeWindow window = TimeWindowResolver.forTier(context.getWindow(), tier());
            String query = withOrderAndBound(sql.getTiers().getLiveCacheWindow(), orderExpression,
                    window.endOperator());
            return read(connection.get(), query,
                    List.of(window.beginText(), window.endText(), properties.getTierRowCap()),
                    SourceTag.LIVE_CACHE, null);
        }
        String query = sql.getTiers().getLiveCacheCurrent()
                .replace(SqlQueriesProperties.ORDER_BY, orderExpression + " DESC");
        return read(connection.get(), query, List.of(properties.getTierRowCap()), SourceTag.LIVE_CACHE_UNFILTERED,
                "Requested date is " + ageDays + " days old; showing current cache contents without the time filter");
    }

    /**
     * Current cache statistics of one statement, summed over its child cursors.
     *
     * @throws TierUnavailableException if the cache cannot be read
     */
    public Optional<HistoryEntry> findBySqlId(MonitoredConnection connection, String sqlId) {
        try {
            return client.query(connection, sql.getTiers().getLiveCacheBySqlId(), List.of(sqlId),
                            Duration.ofSeconds(properties.getQueryTimeoutSeconds()), SqlStatRowMapper.INSTANCE)
                    .stream()
                    .findFirst()
                    .map(row -> HistoryEntry.fromStatRow(row, SourceTag.LIVE_CACHE));
        } catch (RuntimeException e) {
            metrics.recordTierFailure(tier());
            throw new TierUnavailableException(tier(), "Live cache lookup of " + sqlId + " failed: " + e.getMessage(), e);
        }
    }
}
