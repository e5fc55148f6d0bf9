package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.RetentionProperties;
import com.di.sqlpulse.target.ConnectionRegistry;
import com.di.sqlpulse.target.MonitoredConnection;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Purges records and daily summaries older than each connection's retention days, and
 * collection logs older than {@code sqlpulse.retention.log-retention-days}.
 */
@Slf4j
@Service
public class RetentionService {

    private final PerformanceRecordStore recordStore;
    private final DailySummaryStore summaryStore;
    private final CollectionLogStore logStore;
    private final CollectionSettingsService settingsService;
    private final ConnectionRegistry registry;
    private final RetentionProperties properties;
    private final ScheduledExecutorService collectionExecutor;
    private final Clock clock;

    private ScheduledFuture<?> cleanupTask;

    public RetentionService(PerformanceRecordStore recordStore, DailySummaryStore summaryStore,
                            CollectionLogStore logStore, CollectionSettingsService settingsService,
                            ConnectionRegistry registry, RetentionProperties properties,
                            ScheduledExecutorService collectionExecutor, Clock clock) {
        this.recordStore = recordStore;
        this.summaryStore = summaryStore;
        this.logStore = logStore;
        this.settingsService = settingsService;
        this.registry = registry;
        this.properties = properties;
        this.collectionExecutor = collectionExecutor;
        this.clock = clock;
    }

    @PostConstruct
    void schedule() {
        if (!properties.isCleanupEnabled()) {
            log.info("[RETENTION] Periodic cleanup disabled");
            return;
        }
        long intervalMinutes = TimeUnit.HOURS.toMinutes(Math.max(1, properties.getCleanupIntervalHours()));
        cleanupTask = collectionExecutor.scheduleAtFixedRate(this::safeCleanup,
                Math.max(0, properties.getInitialDelayMinutes()), intervalMinutes, TimeUnit.MINUTES);
        log.info("[RETENTION] Cleanup scheduled every {}h", properties.getCleanupIntervalHours());
    }

    @PreDestroy
    void cancel() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
    }

    public RetentionReport cleanup() {
        LocalDate today = LocalDate.now(clock);
        Set<String> connectionIds = new LinkedHashSet<>();
        registry.findAll().stream().map(MonitoredConnection::id).forEach(connectionIds::add);
        settingsService.findAll().forEach(s -> connectionIds.add(s.getConnectionId()));

        int records = 0;
        int summaries = 0;
        for (String connectionId : connectionIds) {
            int retentionDays = settingsService.getEffective(connectionId).getRetentionDays();
            LocalDate cutoff = today.minusDays(retentionDays);
            records += recordStore.deleteCollectedBefore(connectionId, cutoff);
            summaries += summaryStore.deleteBefore(connectionId, cutoff);
        }
        Instant logCutoff = clock.instant().minus(properties.getLogRetentionDays(), ChronoUnit.DAYS);
        int logs = logStore.deleteStartedBefore(logCutoff);

        RetentionReport report = new RetentionReport(connectionIds.size(), records, summaries, logs, clock.instant());
        log.info("[RETENTION] connections={} | records={} | summaries={} | logs={}",
                report.connections(), records, summaries, logs);
        return report;
    }

    private void safeCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("[RETENTION] Cleanup failed: {}", e.getMessage(), e);
        }
    }
}
