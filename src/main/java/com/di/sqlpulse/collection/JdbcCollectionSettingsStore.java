package com.di.sqlpulse.collection;

import com.di.sqlpulse.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of CollectionSettingsStore (table performance_collection_settings).
 * Excluded schemas are stored comma-separated.
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "true")
public class JdbcCollectionSettingsStore implements CollectionSettingsStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcCollectionSettingsStore(JdbcTemplate storageJdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = storageJdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<CollectionSettings> SETTINGS_ROW_MAPPER = (rs, rowNum) -> CollectionSettings.builder()
            .connectionId(rs.getString("connection_id"))
            .enabled(rs.getBoolean("enabled"))
            .intervalMinutes(rs.getInt("collection_interval_minutes"))
            .retentionDays(rs.getInt("retention_days"))
            .minExecutions(rs.getLong("min_executions"))
            .minElapsedTimeMs(rs.getDouble("min_elapsed_time_ms"))
            .excludedSchemas(splitSchemas(rs.getString("excluded_schemas")))
            .rowLimit(rs.getInt("top_sql_limit"))
            .collectAllHours(rs.getBoolean("collect_all_hours"))
            .collectStartHour(rs.getInt("collect_start_hour"))
            .collectEndHour(rs.getInt("collect_end_hour"))
            .totalCollections(rs.getLong("total_collections"))
            .successfulCollections(rs.getLong("successful_collections"))
            .failedCollections(rs.getLong("failed_collections"))
            .lastCollectionAt(toInstant(rs.getTimestamp("last_collection_at")))
            .lastCollectionStatus(rs.getString("last_collection_status") != null
                    ? CollectionStatus.valueOf(rs.getString("last_collection_status")) : null)
            .lastCollectionCount(rs.getInt("last_collection_count"))
            .lastErrorMessage(rs.getString("last_error_message"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();

    private static List<String> splitSchemas(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public Optional<CollectionSettings> find(String connectionId) {
        List<CollectionSettings> list = jdbc.query(sql.getSettings().getFind(), SETTINGS_ROW_MAPPER, connectionId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<CollectionSettings> findAll() {
        return jdbc.query(sql.getSettings().getFindAll(), SETTINGS_ROW_MAPPER);
    }

    @Override
    public void save(CollectionSettings s) {
        int updated = jdbc.update(sql.getSettings().getUpdate(), updateArgs(s));
        if (updated == 0) {
            jdbc.update(sql.getSettings().getInsert(), insertArgs(s));
        }
    }

    private static Object[] insertArgs(CollectionSettings s) {
        Object[] update = updateArgs(s);
        Object[] args = new Object[update.length + 1];
        // insert columns: connection_id, the update columns up to updated_at, created_at
        args[0] = s.getConnectionId();
        System.arraycopy(update, 0, args, 1, update.length - 1);
        args[update.length] = toTimestamp(s.getCreatedAt() != null ? s.getCreatedAt() : s.getUpdatedAt());
        return args;
    }

    private static Object[] updateArgs(CollectionSettings s) {
        return new Object[]{
                s.isEnabled(),
                s.getIntervalMinutes(),
                s.getRetentionDays(),
                s.getMinExecutions(),
                s.getMinElapsedTimeMs(),
                String.join(",", s.getExcludedSchemas()),
                s.getRowLimit(),
                s.isCollectAllHours(),
                s.getCollectStartHour(),
                s.getCollectEndHour(),
                s.getTotalCollections(),
                s.getSuccessfulCollections(),
                s.getFailedCollections(),
                toTimestamp(s.getLastCollectionAt()),
                s.getLastCollectionStatus() != null ? s.getLastCollectionStatus().name() : null,
                s.getLastCollectionCount(),
                s.getLastErrorMessage(),
                toTimestamp(s.getUpdatedAt()),
                s.getConnectionId()
        };
    }

    @Override
    public boolean delete(String connectionId) {
        return jdbc.update(sql.getSettings().getDelete(), connectionId) > 0;
    }
}
