package com.di.sqlpulse.target;

import com.di.sqlpulse.tier.EditionCapability;

/**
 * A monitored database as supplied by the connection registry. Read-only to the core.
 *
 * @param edition declared engine edition (e.g. "Enterprise Edition"); drives tier B gating
 */
public record MonitoredConnection(String id, String name, String jdbcUrl, String username, String password,
                                  String driverClassName, String edition) {

    public EditionCapability capability() {
        return EditionCapability.fromEdition(edition);
    }

    @Override
    public String toString() {
        return "MonitoredConnection[id=" + id + ", name=" + name + ", url=" + jdbcUrl
                + ", user=" + username + ", edition=" + edition + "]";
    }
}
