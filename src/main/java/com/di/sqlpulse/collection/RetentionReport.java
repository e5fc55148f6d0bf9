package com.di.sqlpulse.collection;

import java.time.Instant;

/** Rows removed by one retention pass. */
public record RetentionReport(int connections, int recordsDeleted, int summariesDeleted, int logsDeleted,
                              Instant ranAt) {
}
