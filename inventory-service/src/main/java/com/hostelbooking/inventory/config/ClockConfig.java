package com.hostelbooking.inventory.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Every "now" and "today" in the service comes from this clock, in the hostel's time zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${inventory.zone:America/Sao_Paulo}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
