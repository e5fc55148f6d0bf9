package com.di.sqlpulse.tier;

import com.di.sqlpulse.config.TierProbeProperties;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.util.TelemetryMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Detects which telemetry tiers a connection can use.
 * <ul>
 *   <li>Tier A: a one-row read of the session-sample view with a short timeout; any error means unavailable.</li>
 *   <li>Tier B: decided from the declared edition, no query.</li>
 *   <li>Tier C: always available.</li>
 * </ul>
 * Results are cached per connection for {@code sqlpulse.tier-probe.cache-ttl-seconds}.
 */
@Slf4j
@Component
public class TierProbe {

    private final TargetDatabaseClient client;
    private final SqlQueriesProperties sql;
    private final TelemetryMetrics metrics;
    private final Clock clock;
    private final Duration probeTimeout;
    private final Cache<String, TierAvailability> cache;

    public TierProbe(TargetDatabaseClient client, SqlQueriesProperties sql, TierProbeProperties properties,
                     TelemetryMetrics metrics, Clock clock) {
        this.client = client;
        this.sql = sql;
        this.metrics = metrics;
        this.clock = clock;
        this.probeTimeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCacheMaxSize())
                .expireAfterWrite(properties.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .build();
    }

    public TierAvailability probe(MonitoredConnection connection) {
        return cache.get(connection.id(), id -> probeNow(connection));
    }

    public void invalidate(String connectionId) {
        cache.invalidate(connectionId);
    }

    TierAvailability probeNow(MonitoredConnection connection) {
        EditionCapability capability = connection.capability();
        boolean ash = probeActiveSessionSamples(connection);
        metrics.recordProbe(ash);
        log.info("[PROBE] connection={} | edition={} | capability={} | ash={}",
                connection.id(), connection.edition(), capability, ash);
        return new TierAvailability(ash, capability, clock.instant());
    }

    private boolean probeActiveSessionSamples(MonitoredConnection connection) {
        try {
            // an empty sample view still counts: the view is readable
            client.query(connection, sql.getTiers().getActiveSessionProbe(), List.of(),
                    probeTimeout, (rs, rowNum) -> rs.getInt(1));
            return true;
        } catch (RuntimeException e) {
            log.debug("[PROBE] Tier A unavailable on {}: {}", connection.id(), e.getMessage());
            return false;
        }
    }
}
