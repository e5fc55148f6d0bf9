package com.di.sqlpulse.tier;

import java.time.Instant;

/**
 * Result of probing one connection. Cached briefly, never persisted.
 *
 * @param activeSessionSamples tier A answered the probe query
 * @param capability            edition capability, decides whether tier B is attempted
 * @param probedAt              when the probe ran
 */
public record TierAvailability(boolean activeSessionSamples, EditionCapability capability, Instant probedAt) {

    public boolean historicalRepositoryAllowed() {
        return capability.allowsHistoricalRepository();
    }

    public boolean isAvailable(Tier tier) {
        return switch (tier) {
            case ACTIVE_SESSION_SAMPLES -> activeSessionSamples;
            case HISTORICAL_REPOSITORY -> historicalRepositoryAllowed();
            case LIVE_CACHE -> true;
        };
    }
}
