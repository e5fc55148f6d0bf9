package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import com.di.sqlpulse.exception.ErrorCategory;
import com.di.sqlpulse.target.ConnectionRegistry;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.tier.TierAvailability;
import com.di.sqlpulse.tier.TierProbe;
import com.di.sqlpulse.util.MdcPropagation;
import com.di.sqlpulse.util.TelemetryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One collection run for one connection.
 * <ol>
 *   <li>Gate checks: connection id given and registered, collection enabled, current hour allowed.
 *       A failed gate returns a skipped result and creates no log.</li>
 *   <li>Create a RUNNING log, probe tiers (cached), read the live cache.</li>
 *   <li>No rows: SUCCESS with zero records.</li>
 *   <li>Otherwise grade, persist in batches, fold the persisted records into the daily summary.</li>
 *   <li>Finalize the log, advance the settings counters, record metrics.</li>
 * </ol>
 * A live-cache failure finalizes the log as FAILED and returns {@code success=false}.
 */
@Slf4j
@Service
public class CollectionService {

    static final String LIVE_CACHE_SOURCE = "v$sql";
    static final String NO_DATA_MESSAGE = "No data to collect";
    static final String DISABLED_MESSAGE = "Collection is disabled for this connection";

    private final ConnectionRegistry registry;
    private final CollectionSettingsService settingsService;
    private final TierProbe tierProbe;
    private final LiveCacheCollector collector;
    private final BatchPersister persister;
    private final DailyAggregator aggregator;
    private final CollectionLogStore logStore;
    private final CollectionProperties properties;
    private final TelemetryMetrics metrics;
    private final Clock clock;

    public CollectionService(ConnectionRegistry registry, CollectionSettingsService settingsService, TierProbe tierProbe,
                             LiveCacheCollector collector, BatchPersister persister, DailyAggregator aggregator,
                             CollectionLogStore logStore, CollectionProperties properties, TelemetryMetrics metrics,
                             Clock clock) {
        this.registry = registry;
        this.settingsService = settingsService;
        this.tierProbe = tierProbe;
        this.collector = collector;
        this.persister = persister;
        this.aggregator = aggregator;
        this.logStore = logStore;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CollectionRunResult collect(String connectionId, CollectionTrigger trigger) {
        if (connectionId == null || connectionId.isBlank()) {
            return skip(connectionId, "missing_connection", "connectionId is required");
        }
        Optional<MonitoredConnection> connection = registry.find(connectionId);
        if (connection.isEmpty()) {
            return skip(connectionId, "unknown_connection", "Unknown connection: " + connectionId);
        }
        CollectionSettings settings = settingsService.getEffective(connectionId);
        if (!settings.isEnabled()) {
            return skip(connectionId, "disabled", DISABLED_MESSAGE);
        }
        int hour = ZonedDateTime.now(clock).getHour();
        if (!settings.isCollectionAllowedAt(hour)) {
            return skip(connectionId, "outside_hours",
                    "Collection not allowed at hour " + hour + ". Allowed: " + settings.allowedHours());
        }

        String runId = UUID.randomUUID().toString();
        String previousRunId = MDC.get(MdcPropagation.RUN_ID);
        MDC.put(MdcPropagation.RUN_ID, runId);
        try {
            return run(connection.get(), settings, runId, trigger);
        } finally {
            if (previousRunId != null) {
                MDC.put(MdcPropagation.RUN_ID, previousRunId);
            } else {
                MDC.remove(MdcPropagation.RUN_ID);
            }
        }
    }

    private CollectionRunResult run(MonitoredConnection connection, CollectionSettings settings, String logId,
                                    CollectionTrigger trigger) {
        String connectionId = connection.id();
        Instant startedAt = clock.instant();
        CollectionLog runningLog = CollectionLog.started(logId, connectionId, LIVE_CACHE_SOURCE, startedAt);
        logStore.insert(runningLog);
        log.info("[COLLECT] Started | connection={} | trigger={} | rowLimit={} | minExecutions={}",
                connectionId, trigger, settings.getRowLimit(), settings.getMinExecutions());

        List<SqlStatRow> rows;
        try {
            TierAvailability availability = tierProbe.probe(connection);
            log.debug("[COLLECT] Tiers for {}: ash={}, capability={}", connectionId,
                    availability.activeSessionSamples(), availability.capability());
            rows = collector.collect(connection, settings);
        } catch (RuntimeException e) {
            return fail(runningLog, settings, e);
        }

        if (rows.isEmpty()) {
            CollectionLog done = finalizeLog(runningLog, CollectionStatus.SUCCESS, 0, 0, null, null);
            settingsService.recordRunOutcome(connectionId, CollectionStatus.SUCCESS, 0, null);
            metrics.recordCollectionRun(CollectionStatus.SUCCESS.name(), durationOf(done), 0);
            log.info("[COLLECT] Finished | connection={} | no rows", connectionId);
            return CollectionRunResult.builder()
                    .success(true)
                    .connectionId(connectionId)
                    .status(CollectionStatus.SUCCESS)
                    .message(NO_DATA_MESSAGE)
                    .durationMs(durationOf(done))
                    .logId(logId)
                    .build();
        }

        try {
            ZonedDateTime collectedAt = ZonedDateTime.now(clock);
            List<PerformanceRecord> records = rows.stream()
                    .map(row -> PerformanceRecord.fromLiveCache(connectionId, row, collectedAt,
                            properties.getSqlTextMaxBytes(), properties.getModuleMaxChars()))
                    .collect(Collectors.toList());

            PersistOutcome outcome = persister.persist(records);
            aggregator.aggregate(connectionId, outcome.inserted());

            CollectionStatus status = outcome.status();
            String errorSummary = outcome.errorSummary();
            CollectionLog done = finalizeLog(runningLog, status, rows.size(), outcome.insertedCount(), errorSummary,
                    outcome.failedBatches() > 0 ? "failedBatches=" + outcome.failedBatches() : null);
            settingsService.recordRunOutcome(connectionId, status, outcome.insertedCount(), errorSummary);
            metrics.recordCollectionRun(status.name(), durationOf(done), rows.size());
            log.info("[COLLECT] Finished | connection={} | status={} | collected={} | inserted={} | errors={} | durationMs={}",
                    connectionId, status, rows.size(), outcome.insertedCount(), outcome.errors().size(), durationOf(done));

            return CollectionRunResult.builder()
                    .success(status != CollectionStatus.FAILED)
                    .connectionId(connectionId)
                    .status(status)
                    .message("Collected " + rows.size() + " statements, stored " + outcome.insertedCount())
                    .rowsCollected(rows.size())
                    .rowsInserted(outcome.insertedCount())
                    .durationMs(durationOf(done))
                    .logId(logId)
                    .errors(outcome.errors().stream().map(RecordError::toString).collect(Collectors.toList()))
                    .build();
        } catch (RuntimeException e) {
            return fail(runningLog, settings, e);
        }
    }

    private CollectionRunResult fail(CollectionLog runningLog, CollectionSettings settings, RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("[COLLECT] Failed | connection={} | category={} | {}", runningLog.getConnectionId(), category, message, e);
        CollectionLog done = finalizeLog(runningLog, CollectionStatus.FAILED, 0, 0, message,
                category.name() + ": " + e.getClass().getName());
        settingsService.recordRunOutcome(settings.getConnectionId(), CollectionStatus.FAILED, 0, message);
        metrics.recordCollectionRun(CollectionStatus.FAILED.name(), durationOf(done), 0);
        return CollectionRunResult.builder()
                .success(false)
                .connectionId(runningLog.getConnectionId())
                .status(CollectionStatus.FAILED)
                .message(message)
                .durationMs(durationOf(done))
                .logId(runningLog.getId())
                .errors(List.of(message))
                .build();
    }

    private CollectionLog finalizeLog(CollectionLog runningLog, CollectionStatus status, int collected, int inserted,
                                      String errorMessage, String errorDetail) {
        CollectionLog done = runningLog.complete(status, clock.instant(), collected, inserted, errorMessage, errorDetail);
        try {
            logStore.complete(done);
        } catch (RuntimeException e) {
            log.error("[COLLECT] Could not finalize log {} as {}: {}", runningLog.getId(), status, e.getMessage(), e);
        }
        return done;
    }

    private static long durationOf(CollectionLog log) {
        return log.getDurationMs() != null ? log.getDurationMs() : 0L;
    }

    private CollectionRunResult skip(String connectionId, String reason, String message) {
        log.info("[COLLECT] Skipped | connection={} | {}", connectionId, message);
        metrics.recordCollectionSkipped(reason);
        return CollectionRunResult.skipped(connectionId, message);
    }
}
