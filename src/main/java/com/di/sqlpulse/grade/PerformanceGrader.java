package com.di.sqlpulse.grade;

/**
 * Grades a statement from its average elapsed time and buffer gets per execution.
 * <p>
 * Both limits of a band must hold; the first band that fits wins:
 * <ul>
 *   <li>A: elapsed &lt; 100 ms and buffer gets &lt; 1,000</li>
 *   <li>B: elapsed &lt; 500 ms and buffer gets &lt; 5,000</li>
 *   <li>C: elapsed &lt; 1,000 ms and buffer gets &lt; 10,000</li>
 *   <li>D: elapsed &lt; 5,000 ms and buffer gets &lt; 50,000</li>
 *   <li>F: anything else</li>
 * </ul>
 * Used by both the collection run and the history reads, so stored and live rows grade alike.
 */
public final class PerformanceGrader {

    private static final double[] ELAPSED_LIMITS_MS = {100, 500, 1_000, 5_000};
    private static final double[] BUFFER_GET_LIMITS = {1_000, 5_000, 10_000, 50_000};
    private static final PerformanceGrade[] BANDS = {
            PerformanceGrade.A, PerformanceGrade.B, PerformanceGrade.C, PerformanceGrade.D
    };

    private PerformanceGrader() {
    }

    public static PerformanceGrade grade(double avgElapsedMs, double avgBufferGets) {
        for (int i = 0; i < BANDS.length; i++) {
            if (avgElapsedMs < ELAPSED_LIMITS_MS[i] && avgBufferGets < BUFFER_GET_LIMITS[i]) {
                return BANDS[i];
            }
        }
        // NaN lands here as well
        return PerformanceGrade.F;
    }
}
