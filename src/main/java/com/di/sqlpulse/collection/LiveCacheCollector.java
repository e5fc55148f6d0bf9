package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import com.di.sqlpulse.exception.TargetQueryException;
import com.di.sqlpulse.exception.TierUnavailableException;
import com.di.sqlpulse.sql.SqlQueriesProperties;
import com.di.sqlpulse.target.MonitoredConnection;
import com.di.sqlpulse.target.TargetDatabaseClient;
import com.di.sqlpulse.tier.SqlStatRow;
import com.di.sqlpulse.tier.SqlStatRowMapper;
import com.di.sqlpulse.tier.Tier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the top statements from the live cache for a collection run: minimum executions,
 * excluded schemas and the row limit are pushed into the query, the minimum per-execution
 * elapsed time is applied to the mapped rows.
 * <p>
 * Engines without the direct read/write columns reject the main query with ORA-00904; the
 * legacy variant is tried once in that case.
 */
@Slf4j
@Component
public class LiveCacheCollector {

    private final TargetDatabaseClient client;
    private final SqlQueriesProperties sql;
    private final Duration timeout;

    public LiveCacheCollector(TargetDatabaseClient client, SqlQueriesProperties sql, CollectionProperties properties) {
        this.client = client;
        this.sql = sql;
        this.timeout = Duration.ofSeconds(properties.getQueryTimeoutSeconds());
    }

    /**
     * @throws TierUnavailableException if the live cache cannot be read
     */
    public List<SqlStatRow> collect(MonitoredConnection connection, CollectionSettings settings) {
        List<String> schemas = settings.getExcludedSchemas() != null ? settings.getExcludedSchemas() : List.of();
        List<Object> args = new ArrayList<>();
        args.add(settings.getMinExecutions());
        args.addAll(schemas);
        args.add(settings.getRowLimit());
        String schemaFilter = excludedSchemasClause(schemas.size());

        List<SqlStatRow> rows;
        try {
            rows = run(connection, sql.getTiers().getLiveCacheCollect(), schemaFilter, args);
        } catch (TargetQueryException e) {
            if (!e.isInvalidIdentifier()) {
                throw new TierUnavailableException(Tier.LIVE_CACHE, e.getMessage(), e);
            }
            log.info("[COLLECT] {} lacks newer v$sql columns; using legacy collection query", connection.id());
            try {
                rows = run(connection, sql.getTiers().getLiveCacheCollectLegacy(), schemaFilter, args);
            } catch (TargetQueryException legacyFailure) {
                throw new TierUnavailableException(Tier.LIVE_CACHE, legacyFailure.getMessage(), legacyFailure);
            }
        }
        if (settings.getMinElapsedTimeMs() <= 0) {
            return rows;
        }
        return rows.stream()
                .filter(r -> r.avgElapsedMs() >= settings.getMinElapsedTimeMs())
                .collect(Collectors.toList());
    }

    private List<SqlStatRow> run(MonitoredConnection connection, String template, String schemaFilter,
                                 List<Object> args) {
        String query = template.replace(SqlQueriesProperties.EXCLUDED_SCHEMAS, schemaFilter);
        return client.query(connection, query, args, timeout, SqlStatRowMapper.INSTANCE);
    }

    /** {@code AND parsing_schema_name NOT IN (?, ?, ...)} with one bind per schema; empty for none. */
    static String excludedSchemasClause(int count) {
        if (count <= 0) {
            return "";
        }
        return "AND parsing_schema_name NOT IN (" + String.join(", ", Collections.nCopies(count, "?")) + ")";
    }
}
