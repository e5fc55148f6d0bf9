package com.di.sqlpulse.history;

/** Values of the {@code source} field of a history result. */
public final class SourceTag {

    public static final String DATABASE = "database";
    public static final String TIER_B = "tier_b";
    public static final String ASH = "ash";
    public static final String LIVE_CACHE = "v$sql";
    /** Live cache read without the time filter because the requested date is too old. */
    public static final String LIVE_CACHE_UNFILTERED = "v$sql_cache";
    public static final String NONE = "none";
    public static final String ERROR = "error";

    private SourceTag() {
    }
}
