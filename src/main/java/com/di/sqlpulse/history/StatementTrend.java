package com.di.sqlpulse.history;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class StatementTrend {
    boolean success;
    String connectionId;
    String sqlId;
    /** {@code tier_b} for snapshot history, {@code v$sql} for the single current point. */
    String source;
    @Builder.Default
    List<StatementTrendPoint> data = List.of();
    Instant timestamp;
}
