package com.di.sqlpulse.collection;

import com.di.sqlpulse.grade.PerformanceGrade;
import com.di.sqlpulse.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DailyAggregator Tests")
class DailyAggregatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 10);

    private InMemoryDailySummaryStore store;
    private DailyAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new InMemoryDailySummaryStore();
        aggregator = new DailyAggregator(store, TestData.metrics(), TestData.clockAt(DAY.atTime(15, 0)));
    }

    private static List<PerformanceRecord> batch(int hour) {
        LocalDateTime at = DAY.atTime(hour, 0);
        return List.of(
                TestData.record("C1", TestData.sqlId(1), at, 50, 200, 10),      // A
                TestData.record("C1", TestData.sqlId(2), at, 700, 8_000, 20),   // C
                TestData.record("C1", TestData.sqlId(3), at, 9_000, 2_000, 30)); // F
    }

    // ============================================================================
    // Seeding
    // ============================================================================

    @Test
    @DisplayName("Should seed the day's summary from the first batch")
    void testAggregate_Seed() {
        DailySummary summary = aggregator.aggregate("C1", batch(9)).orElseThrow();

        assertEquals(DAY, summary.getSummaryDate());
        assertEquals(3, summary.getTotalStatements());
        assertEquals(60, summary.getTotalExecutions());
        assertEquals(3250.0, summary.getAvgElapsedTimeMs());
        assertEquals(9_000.0, summary.getMaxElapsedTimeMs());
        assertEquals(8_000, summary.getMaxBufferGets());
        assertEquals(1, summary.getGrades().count(PerformanceGrade.A));
        assertEquals(1, summary.getGrades().count(PerformanceGrade.C));
        assertEquals(1, summary.getGrades().count(PerformanceGrade.F));
        assertEquals(9, summary.getPeakHour());
        assertEquals(1, summary.getCollectionCount());
        assertTrue(store.find("C1", DAY).isPresent());
    }

    @Test
    @DisplayName("Should do nothing for an empty batch")
    void testAggregate_Empty() {
        assertTrue(aggregator.aggregate("C1", List.of()).isEmpty());
        assertTrue(store.findRange("C1", DAY, DAY).isEmpty());
    }

    // ============================================================================
    // Merging
    // ============================================================================

    @Test
    @DisplayName("Should sum additive counters when the same batch is merged twice")
    void testAggregate_MergeTwice() {
        aggregator.aggregate("C1", batch(9));
        DailySummary merged = aggregator.aggregate("C1", batch(9)).orElseThrow();

        assertEquals(6, merged.getTotalStatements());
        assertEquals(120, merged.getTotalExecutions());
        assertEquals(2, merged.getCollectionCount());
        assertEquals(6, merged.getGrades().total());
        // mean of equal values is unchanged
        assertEquals(3250.0, merged.getAvgElapsedTimeMs());
        assertEquals(9_000.0, merged.getMaxElapsedTimeMs());
        assertEquals(merged, store.find("C1", DAY).orElseThrow());
    }

    @Test
    @DisplayName("Should move the peak hour to a busier batch only")
    void testAggregate_PeakHour() {
        aggregator.aggregate("C1", batch(9));
        List<PerformanceRecord> busier = List.of(TestData.record("C1", TestData.sqlId(4), DAY.atTime(11, 0), 10, 10, 500));
        List<PerformanceRecord> quieter = List.of(TestData.record("C1", TestData.sqlId(5), DAY.atTime(13, 0), 10, 10, 5));

        assertEquals(11, aggregator.aggregate("C1", busier).orElseThrow().getPeakHour());
        DailySummary last = aggregator.aggregate("C1", quieter).orElseThrow();
        assertEquals(11, last.getPeakHour());
        assertEquals(500, last.getPeakHourExecutions());
    }

    @Test
    @DisplayName("Should merge when another run seeded the day concurrently")
    void testAggregate_ConcurrentSeed() {
        DailySummary existing = DailySummary.seed("C1", DAY, BatchStatistics.of(batch(8)), DAY.atTime(8, 0)
                .toInstant(java.time.ZoneOffset.UTC));
        DailySummaryStore racing = new InMemoryDailySummaryStore() {
            private boolean first = true;

            @Override
            public Optional<DailySummary> find(String connectionId, LocalDate date) {
                if (first) {
                    first = false;
                    super.insert(existing);
                    return Optional.empty();
                }
                return super.find(connectionId, date);
            }
        };
        DailyAggregator racingAggregator = new DailyAggregator(racing, TestData.metrics(),
                TestData.clockAt(DAY.atTime(15, 0)));

        DailySummary merged = racingAggregator.aggregate("C1", batch(9)).orElseThrow();

        assertEquals(2, merged.getCollectionCount());
        assertEquals(120, merged.getTotalExecutions());
    }

    @Test
    @DisplayName("Should swallow store failures so the run is not failed")
    void testAggregate_StoreFailure() {
        DailySummaryStore broken = new InMemoryDailySummaryStore() {
            @Override
            public Optional<DailySummary> find(String connectionId, LocalDate date) {
                throw new DuplicateKeyException("boom");
            }
        };
        DailyAggregator failing = new DailyAggregator(broken, TestData.metrics(), TestData.clockAt(DAY.atTime(15, 0)));

        assertTrue(failing.aggregate("C1", batch(9)).isEmpty());
    }
}
