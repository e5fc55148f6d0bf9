package com.di.sqlpulse.history;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HistoryResult {
    boolean success;
    @Builder.Default
    List<HistoryEntry> data = List.of();
    String date;
    int count;
    String source;
    String warning;
    TimeFilter timeFilter;

    /** Echo of the requested time range; null for a whole-day read. */
    public record TimeFilter(String startTime, String endTime, String startDatetime, String endDatetime) {
    }

    public static HistoryResult of(String date, List<HistoryEntry> data, String source, String warning,
                                   TimeFilter timeFilter) {
        return HistoryResult.builder()
                .success(true)
                .data(List.copyOf(data))
                .date(date)
                .count(data.size())
                .source(source)
                .warning(warning)
                .timeFilter(timeFilter)
                .build();
    }

    public static HistoryResult none(String date, TimeFilter timeFilter) {
        return of(date, List.of(), SourceTag.NONE, null, timeFilter);
    }

    /** An unexpected failure still answers with an empty, successful envelope. */
    public static HistoryResult error(String date, String warning) {
        return of(date, List.of(), SourceTag.ERROR, warning, null);
    }
}
