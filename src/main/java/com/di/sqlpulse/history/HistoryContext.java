package com.di.sqlpulse.history;

import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.tier.EditionCapability;
import com.di.sqlpulse.tier.TierAvailability;
import com.di.sqlpulse.window.TimeWindow;

import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Inputs shared by the cascade steps of one read. Tier availability is probed on first use
 * only, so a read answered from durable storage never touches the monitored database.
 */
public class HistoryContext {

    private final String connectionId;
    private final MonitoredConnection connection;
    private final TimeWindow window;
    private final SortKey sortKey;
    private final int limit;
    private final LocalDate today;
    private final Supplier<TierAvailability> availabilitySupplier;
    private TierAvailability availability;

    public HistoryContext(String connectionId, MonitoredConnection connection, TimeWindow window, SortKey sortKey,
                          int limit, LocalDate today, Supplier<TierAvailability> availabilitySupplier) {
        this.connectionId = connectionId;
        this.connection = connection;
        this.window = window;
        this.sortKey = sortKey;
        this.limit = limit;
        this.today = today;
        this.availabilitySupplier = availabilitySupplier;
    }

    public String getConnectionId() {
        return connectionId;
    }

    /** Empty when the id is not registered; live tiers are then skipped. */
    public Optional<MonitoredConnection> getConnection() {
        return Optional.ofNullable(connection);
    }

    public TimeWindow getWindow() {
        return window;
    }

    public SortKey getSortKey() {
        return sortKey;
    }

    public int getLimit() {
        return limit;
    }

    public LocalDate getToday() {
        return today;
    }

    public EditionCapability getCapability() {
        return connection != null ? connection.capability() : EditionCapability.UNKNOWN;
    }

    public synchronized TierAvailability getAvailability() {
        if (availability == null) {
            availability = availabilitySupplier.get();
        }
        return availability;
    }
}
