package com.di.sqlpulse.exception;

import java.util.List;

/**
 * Collection settings outside their allowed ranges. Carries every violation, not just the first.
 */
public class InvalidSettingsException extends IllegalArgumentException {

    private final List<String> violations;

    public InvalidSettingsException(List<String> violations) {
        super("Invalid collection settings: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
