package com.di.sqlpulse.api;

import com.di.sqlpulse.api.dto.CollectRequest;
import com.di.sqlpulse.collection.CollectionRunResult;
import com.di.sqlpulse.collection.CollectionScheduler;
import com.di.sqlpulse.collection.CollectionService;
import com.di.sqlpulse.collection.CollectionStatus;
import com.di.sqlpulse.collection.CollectionStatusService;
import com.di.sqlpulse.collection.CollectionStatusView;
import com.di.sqlpulse.collection.CollectionTrigger;
import com.di.sqlpulse.collection.SchedulerState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Collection runs and timers.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/monitoring/collect</td><td>Collect now (synchronous)</td></tr>
 * <tr><td>GET</td><td>/api/monitoring/collect?connectionId=</td><td>Settings, timer, recent logs, today's summary</td></tr>
 * <tr><td>DELETE</td><td>/api/monitoring/collect?connectionId=&amp;logId=|deleteAll=true</td><td>Purge logs</td></tr>
 * <tr><td>POST</td><td>/api/monitoring/collect/schedule/start?connectionId=</td><td>Start or restart the timer</td></tr>
 * <tr><td>POST</td><td>/api/monitoring/collect/schedule/stop?connectionId=</td><td>Stop the timer</td></tr>
 * <tr><td>GET</td><td>/api/monitoring/collect/schedule</td><td>All timer states</td></tr>
 * </table>
 */
@Slf4j
@RestController
@RequestMapping("/api/monitoring/collect")
@RequiredArgsConstructor
public class CollectionController {

    private final CollectionService collectionService;
    private final CollectionStatusService statusService;
    private final CollectionScheduler scheduler;

    /* ------------------------------------------------------------------ */
    /* Runs                                                                 */
    /* ------------------------------------------------------------------ */

    @PostMapping
    public ResponseEntity<CollectionRunResult> collect(@Valid @RequestBody CollectRequest request) {
        log.info("[CONTROLLER] POST /api/monitoring/collect connection={}", request.getConnectionId());
        CollectionRunResult result = collectionService.collect(request.getConnectionId(), CollectionTrigger.MANUAL);
        HttpStatus status = result.getStatus() == CollectionStatus.FAILED
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping
    public CollectionStatusView status(@RequestParam String connectionId) {
        return statusService.status(connectionId);
    }

    @DeleteMapping
    public Map<String, Object> purgeLogs(@RequestParam String connectionId,
                                         @RequestParam(required = false) String logId,
                                         @RequestParam(defaultValue = "false") boolean deleteAll) {
        if (logId == null && !deleteAll) {
            throw new IllegalArgumentException("Either logId or deleteAll=true is required");
        }
        int deleted = statusService.purgeLogs(connectionId, deleteAll ? null : logId);
        log.info("[CONTROLLER] Purged {} log(s) for {}", deleted, connectionId);
        return Map.of("success", true, "deleted", deleted);
    }

    /* ------------------------------------------------------------------ */
    /* Timers                                                               */
    /* ------------------------------------------------------------------ */

    @PostMapping("/schedule/start")
    public SchedulerState startSchedule(@RequestParam String connectionId,
                                        @RequestParam(required = false) Integer intervalMinutes) {
        return intervalMinutes != null
                ? scheduler.start(connectionId, intervalMinutes)
                : scheduler.start(connectionId);
    }

    @PostMapping("/schedule/stop")
    public Map<String, Object> stopSchedule(@RequestParam String connectionId) {
        boolean stopped = scheduler.stop(connectionId);
        return Map.of("success", true, "connection_id", connectionId, "stopped", stopped);
    }

    @GetMapping("/schedule")
    public List<SchedulerState> schedules() {
        return scheduler.getStates();
    }
}
