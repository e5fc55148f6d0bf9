package com.di.sqlpulse.collection;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class CollectionStatusService {

    static final int RECENT_LOG_LIMIT = 10;

    private final CollectionSettingsService settingsService;
    private final CollectionScheduler scheduler;
    private final CollectionLogStore logStore;
    private final DailySummaryStore summaryStore;
    private final PerformanceRecordStore recordStore;
    private final Clock clock;

    public CollectionStatusView status(String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        Optional<CollectionSettings> stored = settingsService.getStored(connectionId);
        return CollectionStatusView.builder()
                .connectionId(connectionId)
                .settings(stored.orElseGet(() -> settingsService.getEffective(connectionId)))
                .defaultSettings(stored.isEmpty())
                .scheduler(scheduler.getState(connectionId).orElseGet(() -> SchedulerState.idle(connectionId)))
                .recentLogs(logStore.findRecent(connectionId, RECENT_LOG_LIMIT))
                .todaySummary(summaryStore.find(connectionId, LocalDate.now(clock)).orElse(null))
                .storedRecordCount(recordStore.countByConnection(connectionId))
                .build();
    }

    /** Deletes one log, or all logs of the connection when {@code logId} is null. */
    public int purgeLogs(String connectionId, String logId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        if (logId != null) {
            return logStore.deleteById(connectionId, logId) ? 1 : 0;
        }
        return logStore.deleteByConnection(connectionId);
    }
}
