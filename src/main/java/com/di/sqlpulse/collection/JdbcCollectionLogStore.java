package com.di.sqlpulse.collection;

import com.di.sqlpulse.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of CollectionLogStore (table performance_collection_logs).
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "true")
public class JdbcCollectionLogStore implements CollectionLogStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcCollectionLogStore(JdbcTemplate storageJdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = storageJdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<CollectionLog> LOG_ROW_MAPPER = (rs, rowNum) -> CollectionLog.builder()
            .id(rs.getString("id"))
            .connectionId(rs.getString("connection_id"))
            .status(CollectionStatus.valueOf(rs.getString("status")))
            .source(rs.getString("source"))
            .startedAt(toInstant(rs.getTimestamp("started_at")))
            .completedAt(toInstant(rs.getTimestamp("completed_at")))
            .durationMs(rs.getObject("duration_ms", Long.class))
            .rowsCollected(rs.getInt("records_collected"))
            .rowsInserted(rs.getInt("records_inserted"))
            .errorMessage(rs.getString("error_message"))
            .errorDetail(rs.getString("error_detail"))
            .build();

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public void insert(CollectionLog log) {
        jdbc.update(sql.getLogs().getInsert(),
                log.getId(),
                log.getConnectionId(),
                log.getStatus().name(),
                log.getSource(),
                toTimestamp(log.getStartedAt()));
    }

    @Override
    public void complete(CollectionLog log) {
        jdbc.update(sql.getLogs().getComplete(),
                log.getStatus().name(),
                toTimestamp(log.getCompletedAt()),
                log.getDurationMs(),
                log.getRowsCollected(),
                log.getRowsInserted(),
                log.getErrorMessage(),
                log.getErrorDetail(),
                log.getId());
    }

    @Override
    public Optional<CollectionLog> findById(String logId) {
        List<CollectionLog> list = jdbc.query(sql.getLogs().getFindById(), LOG_ROW_MAPPER, logId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<CollectionLog> findRecent(String connectionId, int limit) {
        return jdbc.query(sql.getLogs().getFindRecent(), LOG_ROW_MAPPER, connectionId, Math.max(1, limit));
    }

    @Override
    public boolean deleteById(String connectionId, String logId) {
        return jdbc.update(sql.getLogs().getDeleteById(), logId, connectionId) > 0;
    }

    @Override
    public int deleteByConnection(String connectionId) {
        return jdbc.update(sql.getLogs().getDeleteByConnection(), connectionId);
    }

    @Override
    public int deleteStartedBefore(Instant cutoff) {
        return jdbc.update(sql.getLogs().getDeleteStartedBefore(), Timestamp.from(cutoff));
    }
}
