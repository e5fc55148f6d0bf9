package com.di.sqlpulse.collection;

import com.di.sqlpulse.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of DailySummaryStore (table sql_performance_daily_summary, unique on
 * connection_id + summary_date; a concurrent first insert surfaces as DuplicateKeyException).
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "true")
public class JdbcDailySummaryStore implements DailySummaryStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcDailySummaryStore(JdbcTemplate storageJdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = storageJdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<DailySummary> SUMMARY_ROW_MAPPER = (rs, rowNum) -> DailySummary.builder()
            .connectionId(rs.getString("connection_id"))
            .summaryDate(rs.getDate("summary_date").toLocalDate())
            .totalStatements(rs.getLong("total_sql_count"))
            .totalExecutions(rs.getLong("total_executions"))
            .avgElapsedTimeMs(rs.getDouble("avg_elapsed_time_ms"))
            .avgCpuTimeMs(rs.getDouble("avg_cpu_time_ms"))
            .avgBufferGets(rs.getDouble("avg_buffer_gets"))
            .avgDiskReads(rs.getDouble("avg_disk_reads"))
            .maxElapsedTimeMs(rs.getDouble("max_elapsed_time_ms"))
            .maxBufferGets(rs.getLong("max_buffer_gets"))
            .grades(GradeHistogram.of(
                    rs.getLong("grade_a_count"),
                    rs.getLong("grade_b_count"),
                    rs.getLong("grade_c_count"),
                    rs.getLong("grade_d_count"),
                    rs.getLong("grade_f_count")))
            .peakHour(rs.getObject("peak_hour", Integer.class))
            .peakHourExecutions(rs.getLong("peak_hour_executions"))
            .collectionCount(rs.getInt("collection_count"))
            .firstCollectionAt(toInstant(rs.getTimestamp("first_collection_at")))
            .lastCollectionAt(toInstant(rs.getTimestamp("last_collection_at")))
            .build();

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public Optional<DailySummary> find(String connectionId, LocalDate date) {
        List<DailySummary> list = jdbc.query(sql.getSummaries().getFind(), SUMMARY_ROW_MAPPER,
                connectionId, Date.valueOf(date));
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public void insert(DailySummary s) {
        jdbc.update(sql.getSummaries().getInsert(),
                s.getConnectionId(), Date.valueOf(s.getSummaryDate()),
                s.getTotalStatements(), s.getTotalExecutions(),
                s.getAvgElapsedTimeMs(), s.getAvgCpuTimeMs(), s.getAvgBufferGets(), s.getAvgDiskReads(),
                s.getMaxElapsedTimeMs(), s.getMaxBufferGets(),
                s.getGrades().getA(), s.getGrades().getB(), s.getGrades().getC(), s.getGrades().getD(),
                s.getGrades().getF(),
                s.getPeakHour(), s.getPeakHourExecutions(), s.getCollectionCount(),
                toTimestamp(s.getFirstCollectionAt()), toTimestamp(s.getLastCollectionAt()));
    }

    @Override
    public void update(DailySummary s) {
        jdbc.update(sql.getSummaries().getUpdate(),
                s.getTotalStatements(), s.getTotalExecutions(),
                s.getAvgElapsedTimeMs(), s.getAvgCpuTimeMs(), s.getAvgBufferGets(), s.getAvgDiskReads(),
                s.getMaxElapsedTimeMs(), s.getMaxBufferGets(),
                s.getGrades().getA(), s.getGrades().getB(), s.getGrades().getC(), s.getGrades().getD(),
                s.getGrades().getF(),
                s.getPeakHour(), s.getPeakHourExecutions(), s.getCollectionCount(),
                toTimestamp(s.getLastCollectionAt()),
                s.getConnectionId(), Date.valueOf(s.getSummaryDate()));
    }

    @Override
    public List<DailySummary> findRange(String connectionId, LocalDate from, LocalDate to) {
        return jdbc.query(sql.getSummaries().getFindRange(), SUMMARY_ROW_MAPPER,
                connectionId, Date.valueOf(from), Date.valueOf(to));
    }

    @Override
    public int deleteBefore(String connectionId, LocalDate cutoff) {
        return jdbc.update(sql.getSummaries().getDeleteBefore(), connectionId, Date.valueOf(cutoff));
    }
}
