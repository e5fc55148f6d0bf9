package com.di.sqlpulse.history;

import com.di.sqlpulse.collection.PerformanceRecord;
import com.di.sqlpulse.collection.PerformanceRecordStore;
import com.di.sqlpulse.window.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/** Records collected earlier for the connection and day, filtered by collection hour. */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class DurableStorageStrategy implements TierQueryStrategy {

    private final PerformanceRecordStore recordStore;

    @Override
    public String name() {
        return SourceTag.DATABASE;
    }

    @Override
    public TierAttempt attempt(HistoryContext context) {
        TimeWindow window = context.getWindow();
        Integer startHour = window.timeFiltered() ? window.startHour() : null;
        Integer endHour = window.timeFiltered() ? window.endHour() : null;
        try {
            List<PerformanceRecord> records = recordStore.findByDate(context.getConnectionId(), window.date(),
                    startHour, endHour, context.getSortKey(), context.getLimit());
            return TierAttempt.answered(SourceTag.DATABASE,
                    records.stream().map(HistoryEntry::fromRecord).collect(Collectors.toList()));
        } catch (RuntimeException e) {
            log.warn("[HISTORY] Durable storage read failed for {}: {}", context.getConnectionId(), e.getMessage());
            return TierAttempt.unavailable("durable storage: " + e.getMessage());
        }
    }
}
