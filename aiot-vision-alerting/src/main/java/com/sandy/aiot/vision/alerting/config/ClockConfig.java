package com.sandy.aiot.vision.alerting.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for history instants, SLA math and escalation due times.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock alertingClock() {
        return Clock.systemUTC();
    }
}
