package com.di.sqlpulse.collection;

import com.di.sqlpulse.grade.PerformanceGrade;

import java.util.Arrays;
import java.util.Collection;

/**
 * Count of records per grade. Immutable.
 */
public final class GradeHistogram {

    private static final GradeHistogram EMPTY = new GradeHistogram(new long[PerformanceGrade.values().length]);

    private final long[] counts;

    private GradeHistogram(long[] counts) {
        this.counts = counts;
    }

    public static GradeHistogram empty() {
        return EMPTY;
    }

    public static GradeHistogram of(long a, long b, long c, long d, long f) {
        return new GradeHistogram(new long[]{a, b, c, d, f});
    }

    public static GradeHistogram of(Collection<PerformanceRecord> records) {
        long[] counts = new long[PerformanceGrade.values().length];
        for (PerformanceRecord r : records) {
            if (r.getPerformanceGrade() != null) {
                counts[r.getPerformanceGrade().ordinal()]++;
            }
        }
        return new GradeHistogram(counts);
    }

    public long count(PerformanceGrade grade) {
        return counts[grade.ordinal()];
    }

    public long total() {
        return Arrays.stream(counts).sum();
    }

    public GradeHistogram plus(GradeHistogram other) {
        long[] sum = new long[counts.length];
        for (int i = 0; i < counts.length; i++) {
            sum[i] = counts[i] + other.counts[i];
        }
        return new GradeHistogram(sum);
    }

    public long getA() { return counts[0]; }
    public long getB() { return counts[1]; }
    public long getC() { return counts[2]; }
    public long getD() { return counts[3]; }
    public long getF() { return counts[4]; }

    @Override
    public boolean equals(Object o) {
        return o instanceof GradeHistogram other && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "GradeHistogram{A=" + counts[0] + ", B=" + counts[1] + ", C=" + counts[2]
                + ", D=" + counts[3] + ", F=" + counts[4] + "}";
    }
}
