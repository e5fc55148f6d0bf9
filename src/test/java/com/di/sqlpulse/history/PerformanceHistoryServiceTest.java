package com.di.sqlpulse.history;

import com.di.sqlpulse.collection.InMemoryPerformanceRecordStore;
import com.di.sqlpulse.config.HistoryProperties;
import com.di.sqlpulse.config.TierProbeProperties;
import com.di.sqlpulse.exception.ConnectionNotFoundException;
import com.di.sqlpulse.exception.InvalidIdentifierException;
import com.di.sqlpulse.exception.StatementNotFoundException;
import com.di.sqlpulse.exception.TargetQueryException;
import com.di.sqlpulse.grade.PerformanceGrade;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.support.FakeTargetDatabaseClient;
import com.di.sqlpulse.support.StaticConnectionRegistry;
import com.di.sqlpulse.support.TestData;
import com.di.sqlpulse.support.TestSqlQueries;
import com.di.sqlpulse.target.ConnectionRegistry;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.tier.TierProbe;
import com.di.sqlpulse.util.TelemetryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PerformanceHistoryService Tests")
class PerformanceHistoryServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 13);

    private FakeTargetDatabaseClient client;
    private InMemoryPerformanceRecordStore recordStore;
    private HistoryProperties properties;

    @BeforeEach
    void setUp() {
        client = new FakeTargetDatabaseClient();
        recordStore = new InMemoryPerformanceRecordStore();
        properties = new HistoryProperties();
    }

    private PerformanceHistoryService service(ConnectionRegistry registry) {
        Clock clock = TestData.clockAt(TODAY.atTime(12, 0));
        SqlQueriesProperties sql = TestSqlQueries.create();
        TelemetryMetrics metrics = TestData.metrics();
        LiveCacheStrategy liveCache = new LiveCacheStrategy(client, sql, properties, metrics);
        CascadingQuerySelector selector = new CascadingQuerySelector(List.of(
                new DurableStorageStrategy(recordStore),
                new HistoricalRepositoryStrategy(client, sql, properties, metrics),
                new ActiveSessionStrategy(client, sql, properties, metrics),
                liveCache));
        TierProbe probe = new TierProbe(client, sql, new TierProbeProperties(), metrics, clock);
        return new PerformanceHistoryService(registry, selector, liveCache, probe, properties, metrics, clock);
    }

    private PerformanceHistoryService service(MonitoredConnection... connections) {
        return service(new StaticConnectionRegistry(connections));
    }

    private static HistoryQuery day(String connectionId, String date) {
        return HistoryQuery.builder().connectionId(connectionId).date(date).build();
    }

    private static TargetQueryException oraError(int code, String message) {
        return new TargetQueryException("C1", "Query failed", new SQLException(message, "72000", code));
    }

    // ============================================================================
    // Durable storage
    // ============================================================================

    @Test
    @DisplayName("Should answer from durable storage without touching the monitored database")
    void testQuery_DurableStorageHit() {
        for (int i = 0; i < 12; i++) {
            recordStore.insert(TestData.record("C1", TestData.sqlId(i), LocalDate.of(2025, 1, 10).atTime(9 + i % 4, 0),
                    10 + i, 100, 5));
        }
        recordStore.insert(TestData.record("C1", TestData.sqlId(99), LocalDate.of(2025, 1, 11).atTime(9, 0), 1, 1, 1));

        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(day("C1", "2025-01-10"));

        assertTrue(result.isSuccess());
        assertEquals(SourceTag.DATABASE, result.getSource());
        assertEquals(12, result.getCount());
        assertEquals(21.0, result.getData().get(0).getAvgElapsedTimeMs());
        assertNull(result.getWarning());
        assertNull(result.getTimeFilter());
        assertTrue(client.calls().isEmpty());
    }

    @Test
    @DisplayName("Should filter durable storage by collection hour for a time range")
    void testQuery_DurableStorageHours() {
        recordStore.insert(TestData.record("C1", TestData.sqlId(1), LocalDate.of(2025, 1, 10).atTime(8, 55), 5, 5, 1));
        recordStore.insert(TestData.record("C1", TestData.sqlId(2), LocalDate.of(2025, 1, 10).atTime(10, 10), 5, 5, 1));
        recordStore.insert(TestData.record("C1", TestData.sqlId(3), LocalDate.of(2025, 1, 10).atTime(12, 0), 5, 5, 1));

        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(HistoryQuery.builder()
                .connectionId("C1").date("2025-01-10").startTime("09:00").endTime("11:30").build());

        assertEquals(SourceTag.DATABASE, result.getSource());
        assertEquals(List.of(TestData.sqlId(2)), result.getData().stream().map(HistoryEntry::getSqlId)
                .collect(Collectors.toList()));
        assertEquals(new HistoryResult.TimeFilter("09:00", "11:30", "2025-01-10 09:00:00", "2025-01-10 11:30:00"),
                result.getTimeFilter());
    }

    // ============================================================================
    // Cascade over the monitored database
    // ============================================================================

    @Test
    @DisplayName("Should use the snapshot repository first with an inclusive snapshot end bound")
    void testQuery_HistoricalRepository() {
        client.returning(TestSqlQueries.HISTORICAL_WINDOW, List.of(
                TestData.statRow(TestData.sqlId(1), 10, 50_000, 300),
                TestData.statRow(TestData.sqlId(2), 4, 8_000_000, 3_000)));

        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(day("C1", "2025-01-10"));

        assertEquals(SourceTag.TIER_B, result.getSource());
        assertEquals(2, result.getCount());
        HistoryEntry slowest = result.getData().get(0);
        assertEquals(TestData.sqlId(2), slowest.getSqlId());
        assertEquals(2000.0, slowest.getAvgElapsedTimeMs());
        assertEquals(PerformanceGrade.D, slowest.getPerformanceGrade());
        assertEquals(SourceTag.TIER_B, slowest.getSource());

        assertEquals(List.of(TestSqlQueries.HISTORICAL_WINDOW), client.queryNames());
        FakeTargetDatabaseClient.Call call = client.calls().get(0);
        assertEquals(List.of("2025-01-10 00:00:00", "2025-01-11 00:00:00", 100), call.args());
        assertTrue(call.sql().contains("begin_interval_time < ?"));
        assertFalse(call.sql().contains("end_interval_time"));
        assertTrue(call.sql().endsWith(SortKey.ELAPSED_TIME.getHistoricalExpression() + " DESC"));
    }

    @Test
    @DisplayName("Should keep the snapshot that begins late in the day and ends after midnight")
    void testQuery_HistoricalRepository_LastSnapshotOfDay() {
        client.returning(TestSqlQueries.HISTORICAL_WINDOW, List.of(TestData.statRow(TestData.sqlId(1), 1, 1_000, 1)));

        service(TestData.connection("C1", TestData.ENTERPRISE)).query(day("C1", "2025-01-10"));

        // a 23:00:00 - 00:00:07 snapshot begins inside [2025-01-10, 2025-01-11) and must match
        FakeTargetDatabaseClient.Call call = client.callsTo(TestSqlQueries.HISTORICAL_WINDOW).get(0);
        assertTrue(call.sql().contains("begin_interval_time >= ? AND begin_interval_time < ?"));
        assertEquals("2025-01-11 00:00:00", call.args().get(1));
    }

    @Test
    @DisplayName("Should bound a time range by the snapshot end, inclusive")
    void testQuery_HistoricalRepository_TimeRange() {
        client.returning(TestSqlQueries.HISTORICAL_WINDOW, List.of(TestData.statRow(TestData.sqlId(1), 1, 1_000, 1)));

        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(HistoryQuery.builder()
                .connectionId("C1").date("2025-01-10").startTime("09:00").endTime("11:00").build());

        assertEquals(SourceTag.TIER_B, result.getSource());
        FakeTargetDatabaseClient.Call call = client.callsTo(TestSqlQueries.HISTORICAL_WINDOW).get(0);
        assertEquals(List.of("2025-01-10 09:00:00", "2025-01-10 11:00:00", 100), call.args());
        assertTrue(call.sql().contains("end_interval_time <= ?"));
    }

    @Test
    @DisplayName("Should fall through to session samples when the snapshot repository fails")
    void testQuery_ActiveSessionSamples() {
        client.failing(TestSqlQueries.HISTORICAL_WINDOW, oraError(13516, "ORA-13516: AWR Operation failed"));
        client.returning(TestSqlQueries.ASH_WINDOW, List.of(TestData.statRow(TestData.sqlId(5), 2, 3_000, 40)));

        HistoryResult result = service(TestData.connection("C1", null)).query(day("C1", "2025-01-12"));

        assertEquals(SourceTag.ASH, result.getSource());
        assertEquals(1, result.getCount());
        assertEquals(List.of(TestSqlQueries.HISTORICAL_WINDOW, TestSqlQueries.ASH_PROBE, TestSqlQueries.ASH_WINDOW),
                client.queryNames());
        assertTrue(client.callsTo(TestSqlQueries.ASH_WINDOW).get(0).sql().contains("sample_time < ?"));
    }

    @Test
    @DisplayName("Should show current cache contents with a warning for an old date on a limited edition")
    void testQuery_OldDateLimitedEdition() {
        client.failing(TestSqlQueries.ASH_PROBE, oraError(942, "ORA-00942: table or view does not exist"));
        client.returning(TestSqlQueries.LIVE_CURRENT, List.of(TestData.statRow(TestData.sqlId(7), 100, 1_000_000, 50)));

        HistoryResult result = service(TestData.connection("C1", TestData.STANDARD)).query(day("C1", "2025-01-10"));

        assertEquals(SourceTag.LIVE_CACHE_UNFILTERED, result.getSource());
        assertEquals(1, result.getCount());
        assertEquals("Requested date is 3 days old; showing current cache contents without the time filter",
                result.getWarning());
        // the snapshot repository is skipped without a query on this edition
        assertEquals(List.of(TestSqlQueries.ASH_PROBE, TestSqlQueries.LIVE_CURRENT), client.queryNames());
        assertEquals(List.of(100), client.callsTo(TestSqlQueries.LIVE_CURRENT).get(0).args());
    }

    @Test
    @DisplayName("Should filter the live cache by a widened window for a recent date")
    void testQuery_RecentDateLiveCache() {
        client.failing(TestSqlQueries.ASH_PROBE, oraError(942, "ORA-00942: table or view does not exist"));
        client.returning(TestSqlQueries.LIVE_WINDOW, List.of(TestData.statRow(TestData.sqlId(8), 1, 700, 2)));

        HistoryResult result = service(TestData.connection("C1", TestData.STANDARD)).query(HistoryQuery.builder()
                .connectionId("C1").date("2025-01-12").startTime("09:30").endTime("11:00").build());

        assertEquals(SourceTag.LIVE_CACHE, result.getSource());
        assertNull(result.getWarning());
        FakeTargetDatabaseClient.Call call = client.callsTo(TestSqlQueries.LIVE_WINDOW).get(0);
        assertEquals(List.of("2025-01-12 09:29:00", "2025-01-12 11:01:00", 100), call.args());
        assertTrue(call.sql().contains("last_active_time <= ?"));
        assertEquals("2025-01-12 09:30:00", result.getTimeFilter().startDatetime());
    }

    @Test
    @DisplayName("Should return source none when every tier is empty")
    void testQuery_NothingFound() {
        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(day("C1", "2025-01-13"));

        assertTrue(result.isSuccess());
        assertEquals(SourceTag.NONE, result.getSource());
        assertEquals(0, result.getCount());
        assertTrue(result.getData().isEmpty());
        assertEquals(List.of(TestSqlQueries.HISTORICAL_WINDOW, TestSqlQueries.ASH_PROBE, TestSqlQueries.ASH_WINDOW,
                TestSqlQueries.LIVE_WINDOW), client.queryNames());
    }

    @Test
    @DisplayName("Should only consult durable storage for an unregistered connection")
    void testQuery_UnknownConnection() {
        HistoryResult result = service().query(day("C9", "2025-01-10"));

        assertEquals(SourceTag.NONE, result.getSource());
        assertTrue(client.calls().isEmpty());
    }

    @Test
    @DisplayName("Should re-sort by the requested metric and apply the limit")
    void testQuery_SortAndLimit() {
        client.returning(TestSqlQueries.HISTORICAL_WINDOW, List.of(
                TestData.statRow(TestData.sqlId(1), 5, 1_000, 10),
                TestData.statRow(TestData.sqlId(2), 500, 1_000, 10),
                TestData.statRow(TestData.sqlId(3), 50, 1_000, 10)));

        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(HistoryQuery.builder()
                .connectionId("C1").date("2025-01-10").sortKey(SortKey.EXECUTIONS).limit(2).build());

        assertEquals(List.of(TestData.sqlId(2), TestData.sqlId(3)),
                result.getData().stream().map(HistoryEntry::getSqlId).collect(Collectors.toList()));
        assertTrue(client.calls().get(0).sql().endsWith("SUM(ss.executions_delta) DESC"));
    }

    @Test
    @DisplayName("Should answer an unexpected failure with an empty error envelope")
    void testQuery_UnexpectedFailure() {
        ConnectionRegistry broken = new StaticConnectionRegistry() {
            @Override
            public Optional<MonitoredConnection> find(String connectionId) {
                throw new IllegalStateException("registry offline");
            }
        };

        HistoryResult result = service(broken).query(day("C1", "2025-01-10"));

        assertTrue(result.isSuccess());
        assertEquals(SourceTag.ERROR, result.getSource());
        assertEquals("registry offline", result.getWarning());
        assertEquals(0, result.getCount());
    }

    // ============================================================================
    // Input validation
    // ============================================================================

    @Test
    @DisplayName("Should reject missing connection id, missing date and malformed times")
    void testQuery_InvalidInput() {
        PerformanceHistoryService service = service(TestData.connection("C1", TestData.ENTERPRISE));

        assertThrows(IllegalArgumentException.class, () -> service.query(day(" ", "2025-01-10")));
        assertThrows(IllegalArgumentException.class, () -> service.query(day("C1", null)));
        assertThrows(IllegalArgumentException.class, () -> service.query(HistoryQuery.builder()
                .connectionId("C1").date("2025-01-10").startTime("25:00").endTime("26:00").build()));
        assertTrue(client.calls().isEmpty());
    }

    @Test
    @DisplayName("Should clamp the limit to the configured maximum")
    void testEffectiveLimit() {
        PerformanceHistoryService service = service();

        assertEquals(500, service.effectiveLimit(null));
        assertEquals(500, service.effectiveLimit(0));
        assertEquals(25, service.effectiveLimit(25));
        assertEquals(1000, service.effectiveLimit(5000));
    }

    // ============================================================================
    // Single statement lookup
    // ============================================================================

    @Test
    @DisplayName("Should look up one statement in the live cache")
    void testQuery_SqlIdFound() {
        client.returning(TestSqlQueries.LIVE_BY_SQL_ID, List.of(TestData.statRow(TestData.sqlId(4), 20, 200_000, 100)));

        HistoryResult result = service(TestData.connection("C1", TestData.ENTERPRISE)).query(HistoryQuery.builder()
                .connectionId("C1").sqlId(TestData.sqlId(4).toUpperCase()).build());

        assertEquals(SourceTag.LIVE_CACHE, result.getSource());
        assertEquals(1, result.getCount());
        assertEquals(10.0, result.getData().get(0).getAvgElapsedTimeMs());
        assertEquals(List.of(TestData.sqlId(4)), client.calls().get(0).args());
    }

    @Test
    @DisplayName("Should reject a malformed statement id before any query")
    void testQuery_SqlIdInvalid() {
        PerformanceHistoryService service = service(TestData.connection("C1", TestData.ENTERPRISE));

        assertThrows(InvalidIdentifierException.class, () -> service.query(HistoryQuery.builder()
                .connectionId("C1").sqlId("abc' OR 1=1 --").build()));
        assertTrue(client.calls().isEmpty());
    }

    @Test
    @DisplayName("Should report a statement or connection that does not exist")
    void testQuery_SqlIdNotFound() {
        PerformanceHistoryService service = service(TestData.connection("C1", TestData.ENTERPRISE));
        HistoryQuery missing = HistoryQuery.builder().connectionId("C1").sqlId(TestData.sqlId(1)).build();
        HistoryQuery unknownConnection = HistoryQuery.builder().connectionId("C9").sqlId(TestData.sqlId(1)).build();

        assertThrows(StatementNotFoundException.class, () -> service.query(missing));
        assertThrows(ConnectionNotFoundException.class, () -> service.query(unknownConnection));
    }

    @Test
    @DisplayName("Should answer a failed statement lookup with an empty error envelope")
    void testQuery_SqlIdCacheFailure() {
        client.failing(TestSqlQueries.LIVE_BY_SQL_ID, oraError(1013, "ORA-01013: user requested cancel"));
        PerformanceHistoryService service = service(TestData.connection("C1", TestData.ENTERPRISE));

        HistoryResult result = service.query(HistoryQuery.builder()
                .connectionId("C1").sqlId(TestData.sqlId(1)).build());

        assertTrue(result.isSuccess());
        assertEquals(SourceTag.ERROR, result.getSource());
        assertTrue(result.getData().isEmpty());
        assertTrue(result.getWarning().contains(TestData.sqlId(1)));
    }
}
