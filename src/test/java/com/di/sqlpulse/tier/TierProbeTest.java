package com.di.sqlpulse.tier;

import com.di.sqlpulse.config.TierProbeProperties;
import com.di.sqlpulse.exception.TargetQueryException;
import com.di.sqlpulse.support.FakeTargetDatabaseClient;
import com.di.sqlpulse.support.TestData;
import com.di.sqlpulse.support.TestSqlQueries;
import com.di.sqlpulse.target.MonitoredConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TierProbe Tests")
class TierProbeTest {

    private FakeTargetDatabaseClient client;
    private TierProbe probe;

    @BeforeEach
    void setUp() {
        client = new FakeTargetDatabaseClient();
        probe = new TierProbe(client, TestSqlQueries.create(), new TierProbeProperties(), TestData.metrics(),
                TestData.clockAt(LocalDateTime.of(2025, 1, 10, 12, 0)));
    }

    @Test
    @DisplayName("Should report tier A available when the sample view answers, even with no rows")
    void testProbe_AshAvailable() {
        MonitoredConnection conn = TestData.connection("C1", TestData.ENTERPRISE);

        TierAvailability availability = probe.probe(conn);

        assertTrue(availability.activeSessionSamples());
        assertEquals(EditionCapability.FULL_FEATURED, availability.capability());
        assertTrue(availability.isAvailable(Tier.HISTORICAL_REPOSITORY));
        assertTrue(availability.isAvailable(Tier.LIVE_CACHE));
        assertEquals(List.of(TestSqlQueries.ASH_PROBE), client.queryNames());
    }

    @Test
    @DisplayName("Should report tier A unavailable when the probe query fails")
    void testProbe_AshUnavailable() {
        client.failing(TestSqlQueries.ASH_PROBE, new TargetQueryException("C2", "Query failed",
                new SQLException("ORA-00942: table or view does not exist", "42000", 942)));
        MonitoredConnection conn = TestData.connection("C2", TestData.STANDARD);

        TierAvailability availability = probe.probe(conn);

        assertFalse(availability.activeSessionSamples());
        assertEquals(EditionCapability.LIMITED, availability.capability());
        assertFalse(availability.isAvailable(Tier.HISTORICAL_REPOSITORY));
        assertTrue(availability.isAvailable(Tier.LIVE_CACHE));
    }

    @Test
    @DisplayName("Should cache the probe result per connection")
    void testProbe_Cached() {
        MonitoredConnection c1 = TestData.connection("C1", TestData.ENTERPRISE);
        MonitoredConnection c2 = TestData.connection("C2", null);

        probe.probe(c1);
        probe.probe(c1);
        probe.probe(c2);

        assertEquals(2, client.callsTo(TestSqlQueries.ASH_PROBE).size());
        assertEquals(EditionCapability.UNKNOWN, probe.probe(c2).capability());
    }

    @Test
    @DisplayName("Should probe again after invalidation")
    void testProbe_Invalidate() {
        MonitoredConnection conn = TestData.connection("C1", TestData.ENTERPRISE);
        probe.probe(conn);

        probe.invalidate("C1");
        probe.probe(conn);

        assertEquals(2, client.callsTo(TestSqlQueries.ASH_PROBE).size());
    }
}
