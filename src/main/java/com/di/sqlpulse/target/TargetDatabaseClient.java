package com.di.sqlpulse.target;

import com.di.sqlpulse.exception.TargetQueryException;
import org.springframework.jdbc.core.RowMapper;

import java.time.Duration;
import java.util.List;

/**
 * Blocking read access to a monitored database.
 */
public interface TargetDatabaseClient {

    /**
     * Runs {@code sql} with positional {@code args}, cancelling it after {@code timeout}.
     *
     * @throws TargetQueryException on any driver or pool failure, including the timeout
     */
    <T> List<T> query(MonitoredConnection connection, String sql, List<?> args, Duration timeout,
                      RowMapper<T> rowMapper);
}
