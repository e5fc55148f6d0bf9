package com.di.sqlpulse.history;

import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.tier.EditionCapability;
import com.di.sqlpulse.tier.Tier;
import com.di.sqlpulse.util.TelemetryMetrics;
import com.di.sqlpulse.window.TimeWindow;
import com.di.sqlpulse.window.TimeWindowResolver;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Tier B: per-statement deltas summed over the snapshots inside the window. Not attempted on
 * editions without the snapshot repository.
 */
@Component
@Order(20)
public class HistoricalRepositoryStrategy extends TargetTierStrategy {

    /** A whole day takes every snapshot that begins on it, including the one ending after midnight. */
    static final String DAY_SNAPSHOT_BOUND = "begin_interval_time <";

    /** A time range takes the snapshots that have ended by its upper bound. */
    static final String RANGE_SNAPSHOT_BOUND = "end_interval_time <=";

    public HistoricalRepositoryStrategy(TargetDatabaseClient client, SqlQueriesProperties sql,
                                        HistoryProperties properties, TelemetryMetrics metrics) {
        super(client, sql, properties, metrics);
    }

    @Override
    protected Tier tier() {
        return Tier.HISTORICAL_REPOSITORY;
    }

    @Override
    public TierAttempt attempt(HistoryContext context) {
        Optional<MonitoredConnection> connection = context.getConnection();
        if (connection.isEmpty()) {
            return TierAttempt.unavailable("unknown connection");
        }
        if (context.getCapability() == EditionCapability.LIMITED) {
            return TierAttempt.unavailable("edition " + connection.get().edition() + " has no snapshot repository");
        }
        TimeWindow window = TimeWindowResolver.forTier(context.getWindow(), tier());
        String query = withOrderAndBound(sql.getTiers().getHistoricalWindow(),
                context.getSortKey().getHistoricalExpression(), window.endOperator())
                .replace(SqlQueriesProperties.SNAPSHOT_BOUND, snapshotBound(window));
        return read(connection.get(), query,
                List.of(window.beginText(), window.endText(), properties.getTierRowCap()),
                SourceTag.TIER_B, null);
    }

    static String snapshotBound(TimeWindow window) {
        return window.timeFiltered() ? RANGE_SNAPSHOT_BOUND : DAY_SNAPSHOT_BOUND;
    }
}
