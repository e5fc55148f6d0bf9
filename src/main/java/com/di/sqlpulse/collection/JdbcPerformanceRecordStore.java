package com.di.sqlpulse.collection;

import com.di.sqlpulse.grade.PerformanceGrade;
import com.di.sqlpulse.history.SortKey;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * JDBC implementation of PerformanceRecordStore (table sql_performance_history).
 * Enable with sqlpulse.storage.persistence-enabled=true.
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "true")
public class JdbcPerformanceRecordStore implements PerformanceRecordStore {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final SqlQueriesProperties sql;
    private final RowMapper<PerformanceRecord> rowMapper;

    public JdbcPerformanceRecordStore(JdbcTemplate storageJdbcTemplate, TransactionTemplate storageTransactionTemplate,
                                      SqlQueriesProperties sql, Clock clock) {
        this.jdbc = storageJdbcTemplate;
        this.tx = storageTransactionTemplate;
        this.sql = sql;
        this.rowMapper = rowMapper(clock.getZone());
    }

    private static RowMapper<PerformanceRecord> rowMapper(ZoneId zone) {
        return (rs, rowNum) -> PerformanceRecord.builder()
                .connectionId(rs.getString("connection_id"))
                .sqlId(rs.getString("sql_id"))
                .planHashValue(rs.getObject("plan_hash_value", Long.class))
                .parsingSchemaName(rs.getString("parsing_schema_name"))
                .module(rs.getString("module"))
                .action(rs.getString("action"))
                .sqlText(rs.getString("sql_text"))
                .executions(rs.getLong("executions"))
                .avgElapsedTimeMs(rs.getDouble("avg_elapsed_time_ms"))
                .avgCpuTimeMs(rs.getDouble("avg_cpu_time_ms"))
                .avgBufferGets(rs.getLong("avg_buffer_gets"))
                .avgDiskReads(rs.getLong("avg_disk_reads"))
                .rowsProcessed(rs.getLong("rows_processed"))
                .physicalReadRequests(rs.getLong("physical_read_requests"))
                .physicalWriteRequests(rs.getLong("physical_write_requests"))
                .directReads(rs.getLong("direct_reads"))
                .directWrites(rs.getLong("direct_writes"))
                .applicationWaitTimeMs(rs.getDouble("application_wait_time_ms"))
                .concurrencyWaitTimeMs(rs.getDouble("concurrency_wait_time_ms"))
                .clusterWaitTimeMs(rs.getDouble("cluster_wait_time_ms"))
                .userIoWaitTimeMs(rs.getDouble("user_io_wait_time_ms"))
                .performanceGrade(PerformanceGrade.fromCode(rs.getString("performance_grade")))
                .source(rs.getString("source"))
                .collectedAt(rs.getTimestamp("collected_at").toInstant().atZone(zone))
                .build();
    }

    @Override
    public void insertBatch(List<PerformanceRecord> records) {
        if (records.isEmpty()) return;
        // one transaction per chunk: a rejected record rolls back the whole chunk
        tx.executeWithoutResult(status ->
                jdbc.batchUpdate(sql.getRecords().getInsert(), records, records.size(),
                        (ps, r) -> {
                            Object[] args = insertArgs(r);
                            for (int i = 0; i < args.length; i++) {
                                ps.setObject(i + 1, args[i]);
                            }
                        }));
    }

    @Override
    public void insert(PerformanceRecord record) {
        jdbc.update(sql.getRecords().getInsert(), insertArgs(record));
    }

    private static Object[] insertArgs(PerformanceRecord r) {
        return new Object[]{
                r.getConnectionId(),
                r.getSqlId(),
                r.getPlanHashValue(),
                r.getParsingSchemaName(),
                r.getModule(),
                r.getAction(),
                r.getSqlText(),
                r.getExecutions(),
                r.getAvgElapsedTimeMs(),
                r.getAvgCpuTimeMs(),
                r.getAvgBufferGets(),
                r.getAvgDiskReads(),
                r.getRowsProcessed(),
                r.getPhysicalReadRequests(),
                r.getPhysicalWriteRequests(),
                r.getDirectReads(),
                r.getDirectWrites(),
                r.getApplicationWaitTimeMs(),
                r.getConcurrencyWaitTimeMs(),
                r.getClusterWaitTimeMs(),
                r.getUserIoWaitTimeMs(),
                r.getPerformanceGrade() != null ? r.getPerformanceGrade().name() : null,
                r.getSource(),
                Timestamp.from(r.getCollectedAt().toInstant()),
                Date.valueOf(r.getCollectionDate()),
                r.getCollectionHour()
        };
    }

    @Override
    public List<PerformanceRecord> findByDate(String connectionId, LocalDate date, Integer startHour, Integer endHour,
                                              SortKey sortKey, int limit) {
        String orderBy = sortKey.getStorageColumn() + " DESC";
        if (startHour == null || endHour == null) {
            return jdbc.query(sql.getRecords().getFindByDate().replace(SqlQueriesProperties.ORDER_BY, orderBy),
                    rowMapper, connectionId, Date.valueOf(date), Math.max(1, limit));
        }
        return jdbc.query(sql.getRecords().getFindByDateAndHours().replace(SqlQueriesProperties.ORDER_BY, orderBy),
                rowMapper, connectionId, Date.valueOf(date), startHour, endHour, Math.max(1, limit));
    }

    @Override
    public long countByConnection(String connectionId) {
        Long count = jdbc.queryForObject(sql.getRecords().getCountByConnection(), Long.class, connectionId);
        return count != null ? count : 0L;
    }

    @Override
    public int deleteCollectedBefore(String connectionId, LocalDate cutoff) {
        return jdbc.update(sql.getRecords().getDeleteCollectedBefore(), connectionId, Date.valueOf(cutoff));
    }
}
