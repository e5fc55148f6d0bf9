package com.di.sqlpulse.target;

import com.di.sqlpulse.exception.TargetQueryException;
import com.di.sqlpulse.util.ConnectionPoolLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs read queries against monitored databases through {@link TargetDataSourceRegistry} pools,
 * with a per-statement timeout ({@link PreparedStatement#setQueryTimeout(int)}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcTargetDatabaseClient implements TargetDatabaseClient {

    private final TargetDataSourceRegistry dataSources;

    @Override
    public <T> List<T> query(MonitoredConnection connection, String sql, List<?> args, Duration timeout,
                             RowMapper<T> rowMapper) {
        DataSource dataSource = dataSources.getOrCreate(connection);
        long start = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(toTimeoutSeconds(timeout));
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                int rowNum = 0;
                while (rs.next()) {
                    rows.add(rowMapper.mapRow(rs, rowNum++));
                }
            }
            log.debug("[TARGET] connection={} | rows={} | durationMs={}", connection.id(), rows.size(),
                    System.currentTimeMillis() - start);
            return rows;
        } catch (SQLException e) {
            if (e instanceof SQLTransientConnectionException) {
                ConnectionPoolLogger.logPoolStats(dataSource, "connection unavailable");
            }
            throw new TargetQueryException(connection.id(), "Target query failed on " + connection.id(), e);
        } catch (RuntimeException e) {
            throw new TargetQueryException(connection.id(), "Target query failed on " + connection.id(), e);
        }
    }

    static int toTimeoutSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toSeconds()));
    }
}
