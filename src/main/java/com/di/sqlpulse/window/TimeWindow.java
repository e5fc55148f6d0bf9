package com.di.sqlpulse.window;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A resolved query window.
 *
 * @param date          the requested calendar day
 * @param begin         inclusive lower bound
 * @param end           upper bound; exclusive for a whole day, inclusive for a time range
 * @param timeFiltered  a start/end time was given
 */
public record TimeWindow(LocalDate date, LocalDateTime begin, LocalDateTime end, boolean timeFiltered) {

    /** Format bound into {@code TO_DATE(?, 'YYYY-MM-DD HH24:MI:SS')}. */
    public static final DateTimeFormatter BOUND_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public boolean endInclusive() {
        return timeFiltered;
    }

    /** SQL comparison operator for the upper bound. */
    public String endOperator() {
        return endInclusive() ? "<=" : "<";
    }

    public String beginText() {
        return BOUND_FORMAT.format(begin);
    }

    public String endText() {
        return BOUND_FORMAT.format(end);
    }

    /** First hour covered, for hour-bucketed durable storage. */
    public int startHour() {
        return begin.getHour();
    }

    /** Last hour covered. */
    public int endHour() {
        if (!timeFiltered) {
            return 23;
        }
        return end.toLocalDate().isAfter(date) ? 23 : end.getHour();
    }

    public boolean contains(LocalDateTime instant) {
        if (instant == null || instant.isBefore(begin)) {
            return false;
        }
        return endInclusive() ? !instant.isAfter(end) : instant.isBefore(end);
    }
}
