package com.di.sqlpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared timer pool for per-connection collection ticks and the retention purge.
 */
@Configuration
public class SchedulingConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService collectionExecutor(CollectionProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread t = new Thread(runnable, "sqlpulse-collector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newScheduledThreadPool(Math.max(1, properties.getSchedulerPoolSize()), threadFactory);
    }
}
