package com.di.sqlpulse.api;

import com.di.sqlpulse.history.HistoryQuery;
import com.di.sqlpulse.history.HistoryResult;
import com.di.sqlpulse.history.PerformanceHistoryService;
import com.di.sqlpulse.history.SortKey;
import com.di.sqlpulse.history.StatementTrend;
import com.di.sqlpulse.history.StatementTrendService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class PerformanceHistoryController {

    private final PerformanceHistoryService historyService;
    private final StatementTrendService trendService;

    /**
     * Statements of one day (optionally one time range), from the first source that has data:
     * collected records, snapshot repository, session samples, live cache.
     */
    @GetMapping("/performance-history")
    public HistoryResult performanceHistory(@RequestParam String connectionId,
                                            @RequestParam(required = false) String date,
                                            @RequestParam(required = false) String startTime,
                                            @RequestParam(required = false) String endTime,
                                            @RequestParam(required = false) String sqlId,
                                            @RequestParam(required = false) String sortBy,
                                            @RequestParam(required = false) Integer limit) {
        return historyService.query(HistoryQuery.builder()
                .connectionId(connectionId)
                .date(date)
                .startTime(startTime)
                .endTime(endTime)
                .sqlId(sqlId)
                .sortKey(SortKey.fromParam(sortBy))
                .limit(limit)
                .build());
    }

    @GetMapping("/sql-history")
    public StatementTrend sqlHistory(@RequestParam String connectionId, @RequestParam String sqlId) {
        return trendService.trend(connectionId, sqlId);
    }
}
