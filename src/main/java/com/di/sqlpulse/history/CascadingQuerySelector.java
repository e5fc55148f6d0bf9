package com.di.sqlpulse.history;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Walks the cascade steps in order and returns the first one that answers with rows. Rows are
 * re-ordered by the requested metric (descending, stable) and cut to the limit.
 */
@Slf4j
@Component
public class CascadingQuerySelector {

    private final List<TierQueryStrategy> strategies;

    /** Strategies in cascade order (Spring sorts the injected list by {@code @Order}). */
    public CascadingQuerySelector(List<TierQueryStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public SelectedRows select(HistoryContext context) {
        List<String> skipped = new ArrayList<>();
        for (TierQueryStrategy strategy : strategies) {
            TierAttempt attempt;
            try {
                attempt = strategy.attempt(context);
            } catch (RuntimeException e) {
                log.warn("[HISTORY] Step {} threw for {}: {}", strategy.name(), context.getConnectionId(),
                        e.getMessage());
                attempt = TierAttempt.unavailable(e.getMessage());
            }
            if (attempt.hasRows()) {
                log.info("[HISTORY] connection={} | date={} | source={} | rows={} | skipped={}",
                        context.getConnectionId(), context.getWindow().date(), attempt.source(),
                        attempt.rows().size(), skipped);
                return new SelectedRows(attempt.source(), order(attempt.rows(), context), attempt.warning());
            }
            skipped.add(strategy.name() + (attempt.ok() ? "(empty)" : "(" + attempt.reason() + ")"));
        }
        log.info("[HISTORY] connection={} | date={} | no rows from any source: {}",
                context.getConnectionId(), context.getWindow().date(), skipped);
        return new SelectedRows(SourceTag.NONE, List.of(), null);
    }

    private static List<HistoryEntry> order(List<HistoryEntry> rows, HistoryContext context) {
        SortKey key = context.getSortKey();
        return rows.stream()
                .sorted(Comparator.comparingDouble((HistoryEntry e) -> key.metricOf(e)).reversed())
                .limit(context.getLimit())
                .collect(Collectors.toList());
    }

    /** Rows of the answering source. */
    public record SelectedRows(String source, List<HistoryEntry> rows, String warning) {
    }
}
