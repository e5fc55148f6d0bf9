package com.di.sqlpulse.history;

import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.exception.ConnectionNotFoundException;
import com.di.sqlpulse.exception.StatementNotFoundException;
import com.di.sqlpulse.exception.TierUnavailableException;
import com.di.sqlpulse.target.ConnectionRegistry;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.tier.EditionCapability;
import com.di.sqlpulse.tier.TierAvailability;
import com.di.sqlpulse.tier.TierProbe;
import com.di.sqlpulse.util.InputValidator;
import com.di.sqlpulse.util.TelemetryMetrics;
import com.di.sqlpulse.window.TimeWindow;
import com.di.sqlpulse.window.TimeWindowResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Performance history for one connection and day.
 * <p>
 * Input problems (missing connection id or date, malformed time, invalid statement id) throw
 * and map to HTTP 400. Anything unexpected during the read is reported as an empty result with
 * {@code source=error}.
 */
@Slf4j
@Service
public class PerformanceHistoryService {

    private final ConnectionRegistry registry;
    private final CascadingQuerySelector selector;
    private final LiveCacheStrategy liveCache;
    private final TierProbe tierProbe;
    private final HistoryProperties properties;
    private final TelemetryMetrics metrics;
    private final Clock clock;

    public PerformanceHistoryService(ConnectionRegistry registry, CascadingQuerySelector selector,
                                     LiveCacheStrategy liveCache, TierProbe tierProbe, HistoryProperties properties,
                                     TelemetryMetrics metrics, Clock clock) {
        this.registry = registry;
        this.selector = selector;
        this.liveCache = liveCache;
        this.tierProbe = tierProbe;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public HistoryResult query(HistoryQuery query) {
        String connectionId = query.getConnectionId();
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        if (query.getSqlId() != null && !query.getSqlId().isBlank()) {
            return lookupStatement(connectionId, query);
        }
        if (query.getDate() == null || query.getDate().isBlank()) {
            throw new IllegalArgumentException("date is required");
        }
        TimeWindow window = TimeWindowResolver.resolve(query.getDate(), query.getStartTime(), query.getEndTime());
        HistoryResult.TimeFilter timeFilter = timeFilterOf(query, window);

        try {
            MonitoredConnection connection = registry.find(connectionId).orElse(null);
            SortKey sortKey = query.getSortKey() != null ? query.getSortKey() : SortKey.ELAPSED_TIME;
            HistoryContext context = new HistoryContext(connectionId, connection, window, sortKey,
                    effectiveLimit(query.getLimit()), LocalDate.now(clock),
                    () -> connection != null
                            ? tierProbe.probe(connection)
                            : new TierAvailability(false, EditionCapability.UNKNOWN, clock.instant()));
            CascadingQuerySelector.SelectedRows selected = selector.select(context);
            metrics.recordHistorySource(selected.source());
            return HistoryResult.of(query.getDate(), selected.rows(), selected.source(), selected.warning(),
                    timeFilter);
        } catch (RuntimeException e) {
            log.error("[HISTORY] Read failed for {} on {}: {}", connectionId, query.getDate(), e.getMessage(), e);
            metrics.recordHistorySource(SourceTag.ERROR);
            return HistoryResult.error(query.getDate(), e.getMessage() != null ? e.getMessage() : "Unknown error");
        }
    }

    /** Limit clamped to {@code [1, max-limit]}; absent means the default. */
    int effectiveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return properties.getDefaultLimit();
        }
        return Math.min(requested, properties.getMaxLimit());
    }

    private HistoryResult lookupStatement(String connectionId, HistoryQuery query) {
        String sqlId = InputValidator.normalizeSqlId(query.getSqlId());
        MonitoredConnection connection = registry.find(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        Optional<HistoryEntry> found;
        try {
            found = liveCache.findBySqlId(connection, sqlId);
        } catch (TierUnavailableException e) {
            log.warn("[HISTORY] Statement lookup {} on {} failed: {}", sqlId, connectionId, e.getMessage());
            metrics.recordHistorySource(SourceTag.ERROR);
            return HistoryResult.error(query.getDate(), e.getMessage());
        }
        HistoryEntry entry = found.orElseThrow(() -> new StatementNotFoundException(connectionId, sqlId));
        metrics.recordHistorySource(SourceTag.LIVE_CACHE);
        return HistoryResult.of(query.getDate(), List.of(entry), SourceTag.LIVE_CACHE, null, null);
    }

    private static HistoryResult.TimeFilter timeFilterOf(HistoryQuery query, TimeWindow window) {
        if (!window.timeFiltered()) {
            return null;
        }
        return new HistoryResult.TimeFilter(query.getStartTime().trim(), query.getEndTime().trim(),
                window.beginText(), window.endText());
    }
}
