package com.di.sqlpulse.history;

/**
 * One step of the history cascade. Implementations never throw: failures come back as
 * {@link TierAttempt#unavailable(String)} so the next step runs.
 */
public interface TierQueryStrategy {

    String name();

    TierAttempt attempt(HistoryContext context);
}
