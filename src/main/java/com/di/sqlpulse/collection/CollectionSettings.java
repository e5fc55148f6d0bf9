package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-connection collection settings and the run counters kept alongside them.
 */
@Value
@Builder(toBuilder = true)
public class CollectionSettings {
    String connectionId;
    boolean enabled;
    int intervalMinutes;
    int retentionDays;
    long minExecutions;
    double minElapsedTimeMs;
    List<String> excludedSchemas;
    int rowLimit;
    boolean collectAllHours;
    int collectStartHour;
    int collectEndHour;

    long totalCollections;
    long successfulCollections;
    long failedCollections;
    Instant lastCollectionAt;
    CollectionStatus lastCollectionStatus;
    int lastCollectionCount;
    String lastErrorMessage;
    Instant createdAt;
    Instant updatedAt;

    public static CollectionSettings defaults(String connectionId, CollectionProperties.Defaults defaults) {
        return CollectionSettings.builder()
                .connectionId(connectionId)
                .enabled(defaults.isEnabled())
                .intervalMinutes(defaults.getIntervalMinutes())
                .retentionDays(defaults.getRetentionDays())
                .minExecutions(defaults.getMinExecutions())
                .minElapsedTimeMs(defaults.getMinElapsedTimeMs())
                .excludedSchemas(List.copyOf(defaults.getExcludedSchemas()))
                .rowLimit(defaults.getRowLimit())
                .collectAllHours(defaults.isCollectAllHours())
                .collectStartHour(defaults.getCollectStartHour())
                .collectEndHour(defaults.getCollectEndHour())
                .build();
    }

    /**
     * Whether a run may start at the given local hour. A start hour after the end hour wraps
     * past midnight (e.g. 22-6).
     */
    public boolean isCollectionAllowedAt(int hour) {
        if (collectAllHours) {
            return true;
        }
        if (collectStartHour <= collectEndHour) {
            return hour >= collectStartHour && hour <= collectEndHour;
        }
        return hour >= collectStartHour || hour <= collectEndHour;
    }

    public String allowedHours() {
        return collectStartHour + "-" + collectEndHour;
    }

    /** Counters advanced for one finished run. */
    public CollectionSettings withRunOutcome(CollectionStatus status, int rowsInserted, String errorMessage,
                                             Instant at) {
        return toBuilder()
                .totalCollections(totalCollections + 1)
                .successfulCollections(successfulCollections + (status == CollectionStatus.FAILED ? 0 : 1))
                .failedCollections(failedCollections + (status == CollectionStatus.FAILED ? 1 : 0))
                .lastCollectionAt(at)
                .lastCollectionStatus(status)
                .lastCollectionCount(rowsInserted)
                .lastErrorMessage(errorMessage)
                .updatedAt(at)
                .build();
    }
}
