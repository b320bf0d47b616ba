package com.vet.clinic.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The clinic's wall clock. Its zone decides which calendar day a confirmation
 * timestamp falls on in reports.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clinicClock(@Value("${clinic.clock.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
