package com.di.sqlpulse.window;

import com.di.sqlpulse.tier.Tier;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Turns a requested date and optional time range into the window each tier is queried with.
 * <ul>
 *   <li>date only: {@code [date 00:00:00, date+1 00:00:00)}</li>
 *   <li>date + start/end: {@code [date start, date end]}</li>
 * </ul>
 * The live cache only records a statement's last activity, so its bounds are widened by one
 * minute on each side when a time range is given. Snapshot and sample tiers use exact bounds.
 */
public final class TimeWindowResolver {

    static final long LIVE_CACHE_WIDEN_MINUTES = 1;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm[:ss]");

    private TimeWindowResolver() {
    }

    public static TimeWindow resolve(LocalDate date, LocalTime startTime, LocalTime endTime) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        if (startTime == null || endTime == null) {
            return new TimeWindow(date, date.atStartOfDay(), date.plusDays(1).atStartOfDay(), false);
        }
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("End time " + endTime + " is before start time " + startTime);
        }
        return new TimeWindow(date, date.atTime(startTime), date.atTime(endTime), true);
    }

    /** Parses {@code yyyy-MM-dd} and {@code HH:mm[:ss]} strings; blank times mean "whole day". */
    public static TimeWindow resolve(String date, String startTime, String endTime) {
        try {
            LocalDate day = LocalDate.parse(date.trim());
            return resolve(day, parseTime(startTime), parseTime(endTime));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Malformed date/time: date=" + date + ", startTime=" + startTime
                    + ", endTime=" + endTime, e);
        }
    }

    /** The window as a given tier should see it. */
    public static TimeWindow forTier(TimeWindow window, Tier tier) {
        if (tier != Tier.LIVE_CACHE || !window.timeFiltered()) {
            return window;
        }
        return new TimeWindow(window.date(),
                window.begin().minusMinutes(LIVE_CACHE_WIDEN_MINUTES),
                window.end().plusMinutes(LIVE_CACHE_WIDEN_MINUTES),
                true);
    }

    private static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return LocalTime.parse(value.trim(), TIME_FORMAT);
    }
}
