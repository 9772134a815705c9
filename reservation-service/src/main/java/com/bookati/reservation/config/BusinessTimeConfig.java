package com.bookati.reservation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Slot dates and times are wall-clock values of the business location; every "now"
 * used for past-slot checks and lock expiry comes from this clock.
 */
@Configuration
public class BusinessTimeConfig {

    @Bean
    public ZoneId businessZoneId(@Value("${reservation.business.zone:Africa/Cairo}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public Clock businessClock(ZoneId businessZoneId) {
        return Clock.system(businessZoneId);
    }
}
