package com.reviewmate.backend.global.common.time;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock for every module. It ticks in microseconds, the precision PostgreSQL keeps for
 * {@code timestamptz}, so timestamps returned right after a write equal the ones read back later.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.tick(Clock.system(ZoneOffset.UTC), Duration.ofNanos(1_000));
    }
}
