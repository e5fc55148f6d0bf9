package com.di.sqlpulse.tier;

import java.util.Locale;

/**
 * What the declared engine edition allows. Tier B requires the top edition; LIMITED editions
 * skip it without a query, UNKNOWN editions attempt it and let a failure cascade.
 */
public enum EditionCapability {
    FULL_FEATURED,
    LIMITED,
    UNKNOWN;

    public static EditionCapability fromEdition(String edition) {
        if (edition == null || edition.isBlank()) {
            return UNKNOWN;
        }
        String lower = edition.toLowerCase(Locale.ROOT);
        if (lower.contains("enterprise")) {
            return FULL_FEATURED;
        }
        if (lower.contains("standard") || lower.contains("express") || lower.contains("personal")) {
            return LIMITED;
        }
        return UNKNOWN;
    }

    public boolean allowsHistoricalRepository() {
        return this != LIMITED;
    }
}
