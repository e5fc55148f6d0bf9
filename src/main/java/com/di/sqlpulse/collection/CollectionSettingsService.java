package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import com.di.sqlpulse.exception.InvalidIdentifierException;
import com.di.sqlpulse.exception.InvalidSettingsException;
import com.di.sqlpulse.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-connection collection settings: defaults for unconfigured connections, validation,
 * upsert, reset, and the run counters updated after each run.
 * <p>
 * Counter updates are read-then-write without locking; overlapping runs of the same
 * connection can lose an increment.
 */
@Slf4j
@Service
public class CollectionSettingsService {

    static final Set<Integer> ALLOWED_INTERVALS = Set.of(5, 10, 15, 30, 60);
    static final int MIN_RETENTION_DAYS = 7;
    static final int MAX_RETENTION_DAYS = 90;
    static final int MIN_ROW_LIMIT = 100;
    static final int MAX_ROW_LIMIT = 1000;

    private final CollectionSettingsStore store;
    private final CollectionProperties.Defaults defaults;
    private final Clock clock;

    public CollectionSettingsService(CollectionSettingsStore store, CollectionProperties properties, Clock clock) {
        this.store = store;
        this.defaults = properties.getDefaults();
        this.clock = clock;
    }

    public Optional<CollectionSettings> getStored(String connectionId) {
        return store.find(connectionId);
    }

    /** Stored settings, or the configured defaults when the connection was never configured. */
    public CollectionSettings getEffective(String connectionId) {
        return store.find(connectionId).orElseGet(() -> CollectionSettings.defaults(connectionId, defaults));
    }

    public List<CollectionSettings> findAll() {
        return store.findAll();
    }

    /**
     * Applies a partial update over the effective settings and stores the result.
     *
     * @throws InvalidSettingsException if any resulting value is out of range
     */
    public CollectionSettings update(String connectionId, CollectionSettingsUpdate update) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        CollectionSettings current = getEffective(connectionId);
        Instant now = clock.instant();
        CollectionSettings.CollectionSettingsBuilder b = current.toBuilder();
        if (update.getEnabled() != null) b.enabled(update.getEnabled());
        if (update.getIntervalMinutes() != null) b.intervalMinutes(update.getIntervalMinutes());
        if (update.getRetentionDays() != null) b.retentionDays(update.getRetentionDays());
        if (update.getMinExecutions() != null) b.minExecutions(update.getMinExecutions());
        if (update.getMinElapsedTimeMs() != null) b.minElapsedTimeMs(update.getMinElapsedTimeMs());
        if (update.getRowLimit() != null) b.rowLimit(update.getRowLimit());
        if (update.getCollectAllHours() != null) b.collectAllHours(update.getCollectAllHours());
        if (update.getCollectStartHour() != null) b.collectStartHour(update.getCollectStartHour());
        if (update.getCollectEndHour() != null) b.collectEndHour(update.getCollectEndHour());

        List<String> violations = new ArrayList<>();
        if (update.getExcludedSchemas() != null) {
            b.excludedSchemas(normalizeSchemas(update.getExcludedSchemas(), violations));
        }
        CollectionSettings candidate = b
                .createdAt(current.getCreatedAt() != null ? current.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        violations.addAll(validate(candidate));
        if (!violations.isEmpty()) {
            throw new InvalidSettingsException(violations);
        }
        store.save(candidate);
        log.info("[SETTINGS] Saved settings for {}: enabled={}, interval={}min, retention={}d, rowLimit={}, hours={}",
                connectionId, candidate.isEnabled(), candidate.getIntervalMinutes(), candidate.getRetentionDays(),
                candidate.getRowLimit(), candidate.isCollectAllHours() ? "all" : candidate.allowedHours());
        return candidate;
    }

    /** Drops stored settings so the connection falls back to defaults. */
    public boolean reset(String connectionId) {
        boolean deleted = store.delete(connectionId);
        if (deleted) {
            log.info("[SETTINGS] Reset {} to defaults", connectionId);
        }
        return deleted;
    }

    /**
     * Advances the run counters. Connections without stored settings are left alone, so a
     * collect-now on an unconfigured connection does not create a settings row.
     */
    public void recordRunOutcome(String connectionId, CollectionStatus status, int rowsInserted, String errorMessage) {
        try {
            store.find(connectionId).ifPresent(current ->
                    store.save(current.withRunOutcome(status, rowsInserted, errorMessage, clock.instant())));
        } catch (RuntimeException e) {
            log.warn("[SETTINGS] Could not update run counters for {}: {}", connectionId, e.getMessage());
        }
    }

    static List<String> validate(CollectionSettings s) {
        List<String> violations = new ArrayList<>();
        if (!ALLOWED_INTERVALS.contains(s.getIntervalMinutes())) {
            violations.add("intervalMinutes must be one of 5, 10, 15, 30, 60 (was " + s.getIntervalMinutes() + ")");
        }
        if (s.getRetentionDays() < MIN_RETENTION_DAYS || s.getRetentionDays() > MAX_RETENTION_DAYS) {
            violations.add("retentionDays must be between " + MIN_RETENTION_DAYS + " and " + MAX_RETENTION_DAYS
                    + " (was " + s.getRetentionDays() + ")");
        }
        if (s.getRowLimit() < MIN_ROW_LIMIT || s.getRowLimit() > MAX_ROW_LIMIT) {
            violations.add("rowLimit must be between " + MIN_ROW_LIMIT + " and " + MAX_ROW_LIMIT
                    + " (was " + s.getRowLimit() + ")");
        }
        if (s.getMinExecutions() < 0) {
            violations.add("minExecutions must not be negative");
        }
        if (s.getMinElapsedTimeMs() < 0) {
            violations.add("minElapsedTimeMs must not be negative");
        }
        if (!isHour(s.getCollectStartHour()) || !isHour(s.getCollectEndHour())) {
            violations.add("collectStartHour and collectEndHour must be between 0 and 23");
        }
        return violations;
    }

    private static boolean isHour(int hour) {
        return hour >= 0 && hour <= 23;
    }

    private static List<String> normalizeSchemas(List<String> schemas, List<String> violations) {
        List<String> normalized = new ArrayList<>();
        for (String schema : schemas) {
            try {
                String name = InputValidator.normalizeSchemaName(schema);
                if (!normalized.contains(name)) {
                    normalized.add(name);
                }
            } catch (InvalidIdentifierException e) {
                violations.add(e.getMessage());
            }
        }
        return List.copyOf(normalized);
    }
}
