package com.di.sqlpulse.tier;

/**
 * Introspection facilities of the monitored engine, in decreasing order of historical depth.
 */
public enum Tier {
    /** Tier A: sampled active sessions ({@code v$active_session_history}). Licensed, short retention. */
    ACTIVE_SESSION_SAMPLES("A", "v$active_session_history"),
    /** Tier B: snapshot repository ({@code dba_hist_sqlstat}). Licensed, top edition only. */
    HISTORICAL_REPOSITORY("B", "dba_hist_sqlstat"),
    /** Tier C: live statement cache ({@code v$sql}). Always present, no retention. */
    LIVE_CACHE("C", "v$sql");

    private final String code;
    private final String view;

    Tier(String code, String view) {
        this.code = code;
        this.view = view;
    }

    public String getCode() {
        return code;
    }

    public String getView() {
        return view;
    }
}
