package com.di.sqlpulse.grade;

/**
 * Letter grade for a statement's per-execution cost. Ordered best to worst.
 */
public enum PerformanceGrade {
    A, B, C, D, F;

    public boolean isWorseThan(PerformanceGrade other) {
        return ordinal() > other.ordinal();
    }

    public static PerformanceGrade fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return valueOf(code.trim().toUpperCase());
    }
}
