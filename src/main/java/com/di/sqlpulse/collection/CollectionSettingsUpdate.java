package com.di.sqlpulse.collection;

import lombok.Data;

import java.util.List;

/**
 * Partial settings change. Null fields keep their current (or default) value.
 */
@Data
public class CollectionSettingsUpdate {
    private Boolean enabled;
    private Integer intervalMinutes;
    private Integer retentionDays;
    private Long minExecutions;
    private Double minElapsedTimeMs;
    private List<String> excludedSchemas;
    private Integer rowLimit;
    private Boolean collectAllHours;
    private Integer collectStartHour;
    private Integer collectEndHour;
}
