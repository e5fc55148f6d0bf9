package com.di.sqlpulse.collection;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Everything the status endpoint reports for one connection. */
@Value
@Builder
public class CollectionStatusView {
    String connectionId;
    CollectionSettings settings;
    boolean defaultSettings;
    SchedulerState scheduler;
    List<CollectionLog> recentLogs;
    DailySummary todaySummary;
    long storedRecordCount;
}
