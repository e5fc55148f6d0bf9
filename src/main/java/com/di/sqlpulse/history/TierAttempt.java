package com.di.sqlpulse.history;

import java.util.List;

/**
 * What one tier returned. {@code ok=false} means the tier could not answer (skipped, failed,
 * timed out); {@code ok=true} with no rows means it answered with nothing.
 */
public record TierAttempt(boolean ok, List<HistoryEntry> rows, String source, String warning, String reason) {

    public TierAttempt {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static TierAttempt answered(String source, List<HistoryEntry> rows) {
        return new TierAttempt(true, rows, source, null, null);
    }

    public static TierAttempt answered(String source, List<HistoryEntry> rows, String warning) {
        return new TierAttempt(true, rows, source, warning, null);
    }

    public static TierAttempt unavailable(String reason) {
        return new TierAttempt(false, List.of(), null, null, reason);
    }

    public boolean hasRows() {
        return ok && !rows.isEmpty();
    }
}
