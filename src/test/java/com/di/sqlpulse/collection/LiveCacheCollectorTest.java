package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import com.di.sqlpulse.exception.TargetQueryException;
import com.di.sqlpulse.exception.TierUnavailableException;
import com.di.sqlpulse.support.FakeTargetDatabaseClient;
import com.di.sqlpulse.support.TestData;
import com.di.sqlpulse.support.TestSqlQueries;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.tier.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LiveCacheCollector Tests")
class LiveCacheCollectorTest {

    private final MonitoredConnection conn = TestData.connection("C1", TestData.ENTERPRISE);
    private FakeTargetDatabaseClient client;
    private LiveCacheCollector collector;
    private CollectionSettings settings;

    @BeforeEach
    void setUp() {
        client = new FakeTargetDatabaseClient();
        CollectionProperties properties = new CollectionProperties();
        collector = new LiveCacheCollector(client, TestSqlQueries.create(), properties);
        settings = CollectionSettings.defaults("C1", properties.getDefaults()).toBuilder()
                .minExecutions(5)
                .excludedSchemas(List.of("SYS", "SYSTEM"))
                .rowLimit(200)
                .build();
    }

    @Test
    @DisplayName("Should bind min executions, each excluded schema and the row limit in order")
    void testCollect_Binds() {
        client.returning(TestSqlQueries.COLLECT, List.of(TestData.statRow(TestData.sqlId(1), 10, 50_000, 100)));

        List<SqlStatRow> rows = collector.collect(conn, settings);

        assertEquals(1, rows.size());
        FakeTargetDatabaseClient.Call call = client.calls().get(0);
        assertEquals(List.of(5L, "SYS", "SYSTEM", 200), call.args());
        assertTrue(call.sql().contains("AND parsing_schema_name NOT IN (?, ?)"));
        assertFalse(call.sql().contains("{excludedSchemas}"));
    }

    @Test
    @DisplayName("Should drop the schema filter when nothing is excluded")
    void testCollect_NoExcludedSchemas() {
        collector.collect(conn, settings.toBuilder().excludedSchemas(List.of()).build());

        FakeTargetDatabaseClient.Call call = client.calls().get(0);
        assertEquals(List.of(5L, 200), call.args());
        assertFalse(call.sql().contains("NOT IN"));
    }

    @Test
    @DisplayName("Should filter rows below the minimum per-execution elapsed time")
    void testCollect_MinElapsedFilter() {
        client.returning(TestSqlQueries.COLLECT, List.of(
                TestData.statRow(TestData.sqlId(1), 10, 10_000, 100),    // 1 ms each
                TestData.statRow(TestData.sqlId(2), 10, 500_000, 100),   // 50 ms each
                TestData.statRow(TestData.sqlId(3), 0, 20_000, 100)));   // never executed, 20 ms

        List<SqlStatRow> rows = collector.collect(conn, settings.toBuilder().minElapsedTimeMs(20).build());

        assertEquals(List.of(TestData.sqlId(2), TestData.sqlId(3)),
                rows.stream().map(SqlStatRow::getSqlId).toList());
    }

    // ============================================================================
    // Older engines
    // ============================================================================

    @Test
    @DisplayName("Should retry with the legacy query on ORA-00904")
    void testCollect_LegacyFallback() {
        client.failing(TestSqlQueries.COLLECT, new TargetQueryException("C1", "Query failed",
                new SQLException("ORA-00904: \"DIRECT_READS\": invalid identifier", "42000", 904)));
        client.returning(TestSqlQueries.COLLECT_LEGACY, List.of(TestData.statRow(TestData.sqlId(7), 3, 9_000, 30)));

        List<SqlStatRow> rows = collector.collect(conn, settings);

        assertEquals(1, rows.size());
        assertEquals(List.of(TestSqlQueries.COLLECT, TestSqlQueries.COLLECT_LEGACY), client.queryNames());
        assertEquals(client.calls().get(0).args(), client.calls().get(1).args());
    }

    @Test
    @DisplayName("Should report the live cache unavailable for other failures")
    void testCollect_OtherFailure() {
        client.failing(TestSqlQueries.COLLECT, new TargetQueryException("C1", "Query failed",
                new SQLException("ORA-12541: TNS:no listener", "08006", 12541)));

        TierUnavailableException ex = assertThrows(TierUnavailableException.class,
                () -> collector.collect(conn, settings));

        assertEquals(Tier.LIVE_CACHE, ex.getTier());
        assertEquals(1, client.calls().size());
    }

    @Test
    @DisplayName("Should report the live cache unavailable when the legacy query fails too")
    void testCollect_LegacyFailure() {
        TargetQueryException invalidColumn = new TargetQueryException("C1", "Query failed",
                new SQLException("ORA-00904: invalid identifier", "42000", 904));
        client.failing(TestSqlQueries.COLLECT, invalidColumn);
        client.failing(TestSqlQueries.COLLECT_LEGACY, invalidColumn);

        assertThrows(TierUnavailableException.class, () -> collector.collect(conn, settings));
        assertEquals(2, client.calls().size());
    }

    @Test
    @DisplayName("Should build one bind placeholder per schema")
    void testExcludedSchemasClause() {
        assertEquals("", LiveCacheCollector.excludedSchemasClause(0));
        assertEquals("AND parsing_schema_name NOT IN (?)", LiveCacheCollector.excludedSchemasClause(1));
        assertEquals("AND parsing_schema_name NOT IN (?, ?, ?)", LiveCacheCollector.excludedSchemasClause(3));
    }
}
