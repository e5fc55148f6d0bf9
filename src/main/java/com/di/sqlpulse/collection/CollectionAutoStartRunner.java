package com.di.sqlpulse.collection;

import com.di.sqlpulse.config.CollectionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts a timer for every stored, enabled collection setting when
 * {@code sqlpulse.collection.auto-start=true}. Runs after the context is ready.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class CollectionAutoStartRunner implements ApplicationRunner {

    private final CollectionProperties properties;
    private final CollectionSettingsService settingsService;
    private final CollectionScheduler scheduler;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isAutoStart()) {
            log.info("[SCHEDULER] Auto-start disabled (sqlpulse.collection.auto-start=false)");
            return;
        }
        int started = 0;
        for (CollectionSettings settings : settingsService.findAll()) {
            if (!settings.isEnabled()) {
                continue;
            }
            try {
                scheduler.start(settings.getConnectionId(), settings.getIntervalMinutes());
                started++;
            } catch (RuntimeException e) {
                log.warn("[SCHEDULER] Auto-start failed for {}: {}", settings.getConnectionId(), e.getMessage());
            }
        }
        log.info("[SCHEDULER] Auto-started {} collection timer(s)", started);
    }
}
