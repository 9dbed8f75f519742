package com.deepansh.trader.config;

import com.deepansh.trader.core.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Enables the cache sweeper and exposes the wall clock and the sleeper as beans
 * so TTL, timestamp, session-id and backoff code can be driven by fakes in tests.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
