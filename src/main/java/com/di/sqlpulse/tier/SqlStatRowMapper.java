package com.di.sqlpulse.tier;

import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Maps the common column set every tier query projects (see {@code sqlpulse.sql.tiers.*}).
 */
public final class SqlStatRowMapper implements RowMapper<SqlStatRow> {

    public static final SqlStatRowMapper INSTANCE = new SqlStatRowMapper();

    private SqlStatRowMapper() {
    }

    @Override
    public SqlStatRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return SqlStatRow.builder()
                .sqlId(rs.getString("sql_id"))
                .planHashValue(nullableLong(rs, "plan_hash_value"))
                .parsingSchemaName(rs.getString("parsing_schema_name"))
                .module(rs.getString("module"))
                .action(rs.getString("action"))
                .sqlText(rs.getString("sql_text"))
                .executions(rs.getLong("executions"))
                .elapsedTimeUs(rs.getDouble("elapsed_time"))
                .cpuTimeUs(rs.getDouble("cpu_time"))
                .bufferGets(rs.getDouble("buffer_gets"))
                .diskReads(rs.getDouble("disk_reads"))
                .rowsProcessed(rs.getLong("rows_processed"))
                .physicalReadRequests(rs.getLong("physical_read_requests"))
                .physicalWriteRequests(rs.getLong("physical_write_requests"))
                .directReads(rs.getLong("direct_reads"))
                .directWrites(rs.getLong("direct_writes"))
                .applicationWaitUs(rs.getDouble("application_wait_time"))
                .concurrencyWaitUs(rs.getDouble("concurrency_wait_time"))
                .clusterWaitUs(rs.getDouble("cluster_wait_time"))
                .userIoWaitUs(rs.getDouble("user_io_wait_time"))
                .firstSeen(toLocalDateTime(rs.getTimestamp("first_seen")))
                .lastSeen(toLocalDateTime(rs.getTimestamp("last_seen")))
                .build();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static LocalDateTime toLocalDateTime(Timestamp ts) {
        return ts != null ? ts.toLocalDateTime() : null;
    }
}
