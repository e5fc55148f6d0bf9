package com.di.sqlpulse.history;

import lombok.Builder;
import lombok.Value;

/**
 * A performance-history read as received from the API. Date and times are the raw strings
 * ({@code yyyy-MM-dd}, {@code HH:mm[:ss]}); they are resolved into a window by the service.
 */
@Value
@Builder
public class HistoryQuery {
    String connectionId;
    String date;
    String startTime;
    String endTime;
    String sqlId;
    @Builder.Default
    SortKey sortKey = SortKey.ELAPSED_TIME;
    Integer limit;
}
