package com.di.sqlpulse.collection;

import com.di.sqlpulse.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of per-connection collection timers. Each timer fires at a fixed rate with an
 * immediate first tick. Ticks never throw: a failing run is counted in the state and the
 * timer keeps going.
 */
@Slf4j
@Component
public class CollectionScheduler {

    private final CollectionService collectionService;
    private final CollectionSettingsService settingsService;
    private final ScheduledExecutorService collectionExecutor;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final Map<String, SchedulerState> states = new ConcurrentHashMap<>();

    public CollectionScheduler(CollectionService collectionService, CollectionSettingsService settingsService,
                               ScheduledExecutorService collectionExecutor, Clock clock) {
        this.collectionService = collectionService;
        this.settingsService = settingsService;
        this.collectionExecutor = collectionExecutor;
        this.clock = clock;
    }

    /** Starts (or restarts) the timer with the connection's effective interval. */
    public SchedulerState start(String connectionId) {
        return start(connectionId, settingsService.getEffective(connectionId).getIntervalMinutes());
    }

    public synchronized SchedulerState start(String connectionId, int intervalMinutes) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive: " + intervalMinutes);
        }
        cancelTimer(connectionId);

        Runnable tick = MdcPropagation.wrapRunnable(Map.of(MdcPropagation.CONNECTION_ID, connectionId),
                () -> runTick(connectionId));
        ScheduledFuture<?> future = collectionExecutor.scheduleAtFixedRate(tick, 0, intervalMinutes, TimeUnit.MINUTES);
        timers.put(connectionId, future);

        SchedulerState state = states.getOrDefault(connectionId, SchedulerState.idle(connectionId)).toBuilder()
                .running(true)
                .intervalMinutes(intervalMinutes)
                .nextCollection(clock.instant())
                .build();
        states.put(connectionId, state);
        log.info("[SCHEDULER] Started | connection={} | intervalMinutes={}", connectionId, intervalMinutes);
        return state;
    }

    public synchronized boolean stop(String connectionId) {
        boolean stopped = cancelTimer(connectionId);
        states.computeIfPresent(connectionId, (id, s) -> s.toBuilder().running(false).nextCollection(null).build());
        if (stopped) {
            log.info("[SCHEDULER] Stopped | connection={}", connectionId);
        }
        return stopped;
    }

    @PreDestroy
    public synchronized void stopAll() {
        List<String> ids = new ArrayList<>(timers.keySet());
        ids.forEach(this::stop);
        if (!ids.isEmpty()) {
            log.info("[SCHEDULER] Stopped {} timer(s) on shutdown", ids.size());
        }
    }

    public boolean isRunning(String connectionId) {
        ScheduledFuture<?> future = timers.get(connectionId);
        return future != null && !future.isDone();
    }

    public Optional<SchedulerState> getState(String connectionId) {
        return Optional.ofNullable(states.get(connectionId));
    }

    public List<SchedulerState> getStates() {
        List<SchedulerState> all = new ArrayList<>(states.values());
        all.sort(Comparator.comparing(SchedulerState::getConnectionId));
        return all;
    }

    void runTick(String connectionId) {
        Instant startedAt = clock.instant();
        CollectionRunResult result;
        try {
            result = collectionService.collect(connectionId, CollectionTrigger.SCHEDULED);
        } catch (RuntimeException e) {
            log.error("[SCHEDULER] Tick failed | connection={} | {}", connectionId, e.getMessage(), e);
            result = CollectionRunResult.builder()
                    .success(false)
                    .connectionId(connectionId)
                    .status(CollectionStatus.FAILED)
                    .message(e.getMessage())
                    .build();
        }
        CollectionRunResult outcome = result;
        states.compute(connectionId, (id, previous) -> {
            SchedulerState s = previous != null ? previous : SchedulerState.idle(id);
            SchedulerState.SchedulerStateBuilder next = s.toBuilder()
                    .lastCollection(startedAt)
                    .nextCollection(s.isRunning()
                            ? startedAt.plus(Duration.ofMinutes(s.getIntervalMinutes()))
                            : null);
            if (outcome.isSkipped()) {
                next.skippedCount(s.getSkippedCount() + 1);
            } else if (outcome.isSuccess()) {
                next.collectionsCount(s.getCollectionsCount() + 1);
            } else {
                next.collectionsCount(s.getCollectionsCount() + 1)
                        .errorCount(s.getErrorCount() + 1)
                        .lastError(outcome.getMessage());
            }
            return next.build();
        });
    }

    private boolean cancelTimer(String connectionId) {
        ScheduledFuture<?> existing = timers.remove(connectionId);
        if (existing == null) {
            return false;
        }
        existing.cancel(false);
        return true;
    }
}
