package com.di.sqlpulse.api;

import com.di.sqlpulse.api.dto.SettingsResponse;
import com.di.sqlpulse.collection.CollectionScheduler;
import com.di.sqlpulse.collection.CollectionSettings;
import com.di.sqlpulse.collection.CollectionSettingsService;
import com.di.sqlpulse.collection.CollectionSettingsUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Per-connection collection settings. Saving a new interval for a connection whose timer is
 * running restarts the timer with that interval.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitoring/collection-settings")
@RequiredArgsConstructor
public class CollectionSettingsController {

    private final CollectionSettingsService settingsService;
    private final CollectionScheduler scheduler;

    @GetMapping(params = "connectionId")
    public SettingsResponse get(@RequestParam String connectionId) {
        Optional<CollectionSettings> stored = settingsService.getStored(connectionId);
        return SettingsResponse.builder()
                .success(true)
                .settings(stored.orElseGet(() -> settingsService.getEffective(connectionId)))
                .usingDefaults(stored.isEmpty())
                .build();
    }

    @GetMapping
    public List<CollectionSettings> list() {
        return settingsService.findAll();
    }

    @PostMapping
    public SettingsResponse save(@RequestParam String connectionId, @RequestBody CollectionSettingsUpdate update) {
        int previousInterval = settingsService.getEffective(connectionId).getIntervalMinutes();
        CollectionSettings saved = settingsService.update(connectionId, update);
        restartIfRunning(connectionId, previousInterval, saved.getIntervalMinutes());
        return SettingsResponse.builder()
                .success(true)
                .settings(saved)
                .message("Settings saved")
                .build();
    }

    @DeleteMapping
    public SettingsResponse reset(@RequestParam String connectionId) {
        int previousInterval = settingsService.getEffective(connectionId).getIntervalMinutes();
        boolean deleted = settingsService.reset(connectionId);
        CollectionSettings defaults = settingsService.getEffective(connectionId);
        restartIfRunning(connectionId, previousInterval, defaults.getIntervalMinutes());
        return SettingsResponse.builder()
                .success(true)
                .settings(defaults)
                .usingDefaults(true)
                .message(deleted ? "Settings reset to defaults" : "No stored settings; defaults already apply")
                .build();
    }

    private void restartIfRunning(String connectionId, int previousInterval, int newInterval) {
        if (previousInterval != newInterval && scheduler.isRunning(connectionId)) {
            log.info("[SETTINGS] Interval of {} changed {} -> {} min, restarting timer",
                    connectionId, previousInterval, newInterval);
            scheduler.start(connectionId, newInterval);
        }
    }
}
