package com.di.sqlpulse.history;

import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.tier.Tier;
import com.di.sqlpulse.util.TelemetryMetrics;
import com.di.sqlpulse.window.TimeWindow;
import com.di.sqlpulse.window.TimeWindowResolver;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Tier A: statements seen in session samples inside the window, with statistics joined from
 * the live cache. Only attempted when the probe found the sample view readable.
 */
@Component
@Order(30)
public class ActiveSessionStrategy extends TargetTierStrategy {

    public ActiveSessionStrategy(TargetDatabaseClient client, SqlQueriesProperties sql,
                                 HistoryProperties properties, TelemetryMetrics metrics) {
        super(client, sql, properties, metrics);
    }

    @Override
    protected Tier tier() {
        return Tier.ACTIVE_SESSION_SAMPLES;
    }

    @Override
    public TierAttempt attempt(HistoryContext context) {
        Optional<MonitoredConnection> connection = context.getConnection();
        if (connection.isEmpty()) {
            return TierAttempt.unavailable("unknown connection");
        }
        if (!context.getAvailability().activeSessionSamples()) {
            return TierAttempt.unavailable("session samples not readable");
        }
        TimeWindow window = TimeWindowResolver.forTier(context.getWindow(), tier());
        String query = sql.getTiers().getActiveSessionWindow()
                .replace(SqlQueriesProperties.END_OPERATOR, window.endOperator());
        return read(connection.get(), query,
                List.of(window.beginText(), window.endText(), properties.getTierRowCap()),
                SourceTag.ASH, null);
    }
}
