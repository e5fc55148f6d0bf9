package com.di.sqlpulse.api;

import com.di.sqlpulse.collection.DailySummary;
import com.di.sqlpulse.collection.DailySummaryStore;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/monitoring/daily-summaries")
@RequiredArgsConstructor
public class DailySummaryController {

    static final int DEFAULT_DAYS = 7;

    private final DailySummaryStore summaryStore;
    private final Clock clock;

    /** Summaries oldest first; defaults to the last seven days ending today. */
    @GetMapping
    public List<DailySummary> summaries(@RequestParam String connectionId,
                                        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_DAYS - 1);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from " + start + " is after to " + end);
        }
        return summaryStore.findRange(connectionId, start, end);
    }
}
