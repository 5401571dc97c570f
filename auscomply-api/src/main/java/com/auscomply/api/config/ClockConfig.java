package com.auscomply.api.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Single time source for SLA, expiry and reporting predicates.
 * Millisecond ticks keep timestamps identical after a database round trip.
 */
@Configuration
public class ClockConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.tickMillis(ZoneOffset.UTC);
    }
}
