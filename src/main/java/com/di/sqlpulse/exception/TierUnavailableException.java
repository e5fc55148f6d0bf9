package com.di.sqlpulse.exception;

import com.di.sqlpulse.tier.Tier;

/**
 * A telemetry tier could not answer: not licensed, missing view, timeout or query error.
 * History reads absorb it and move to the next tier; a collection run records it in a FAILED log.
 */
public class TierUnavailableException extends RuntimeException {

    private final Tier tier;

    public TierUnavailableException(Tier tier, String message) {
        super(message);
        this.tier = tier;
    }

    public TierUnavailableException(Tier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public Tier getTier() {
        return tier;
    }
}
