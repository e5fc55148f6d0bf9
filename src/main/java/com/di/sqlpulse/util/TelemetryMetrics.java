package com.di.sqlpulse.util;

import com.di.sqlpulse.tier.Tier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for collection runs, history reads and tier health.
 */
@Slf4j
@Component
public class TelemetryMetrics {

    private final MeterRegistry meterRegistry;

    private final Timer collectionRunTimer;
    private final DistributionSummary collectedRowsDistribution;
    private final Counter recordFailureCounter;
    private final Counter aggregationFailureCounter;

    public TelemetryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.collectionRunTimer = Timer.builder("sqlpulse.collection.duration")
                .description("Time taken by a collection run, from log creation to finalization")
                .register(meterRegistry);

        this.collectedRowsDistribution = DistributionSummary.builder("sqlpulse.collection.rows")
                .description("Statements returned by the live cache per collection run")
                .baseUnit("rows")
                .register(meterRegistry);

        this.recordFailureCounter = Counter.builder("sqlpulse.persist.record.failures")
                .description("Records rejected by durable storage after a failed batch")
                .register(meterRegistry);

        this.aggregationFailureCounter = Counter.builder("sqlpulse.aggregation.failures")
                .description("Daily summary updates that failed and were skipped")
                .register(meterRegistry);
    }

    // ============================================================================
    // Collection
    // ============================================================================

    /**
     * Records a finished collection run.
     *
     * @param status        SUCCESS, PARTIAL or FAILED
     * @param durationMs    run duration
     * @param rowsCollected statements returned by the live cache
     */
    public void recordCollectionRun(String status, long durationMs, int rowsCollected) {
        Counter.builder("sqlpulse.collection.runs")
                .description("Collection runs by final status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
        collectionRunTimer.record(durationMs, TimeUnit.MILLISECONDS);
        collectedRowsDistribution.record(rowsCollected);
        log.debug("Recorded collection run: status={}, durationMs={}, rows={}", status, durationMs, rowsCollected);
    }

    public void recordCollectionSkipped(String reason) {
        Counter.builder("sqlpulse.collection.skipped")
                .description("Collection triggers skipped before a log was created")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordRecordFailures(int count) {
        if (count > 0) {
            recordFailureCounter.increment(count);
        }
    }

    public void recordAggregationFailure() {
        aggregationFailureCounter.increment();
    }

    // ============================================================================
    // History reads and tiers
    // ============================================================================

    /** Counts which source answered a history read (database, tier_b, ash, v$sql, ...). */
    public void recordHistorySource(String source) {
        Counter.builder("sqlpulse.history.reads")
                .description("History reads by answering source")
                .tag("source", source)
                .register(meterRegistry)
                .increment();
    }

    public void recordTierFailure(Tier tier) {
        Counter.builder("sqlpulse.tier.failures")
                .description("Tier queries that failed or timed out")
                .tag("tier", tier.getCode())
                .register(meterRegistry)
                .increment();
    }

    public void recordProbe(boolean activeSessionSamplesAvailable) {
        Counter.builder("sqlpulse.tier.probes")
                .description("Tier probes by tier A outcome")
                .tag("ash", Boolean.toString(activeSessionSamplesAvailable))
                .register(meterRegistry)
                .increment();
    }
}
