package com.di.sqlpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** System zone: collection hours and dates are local to the server running the collector. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
